package com.agentvm.pool;

/**
 * API misuse: the released machine is not checked out from this pool
 * (never acquired here, or already released).
 */
public class UnknownMachineException extends VmPoolException {
    public UnknownMachineException(String poolId, String machineName) {
        super("Machine " + machineName + " is not checked out from pool " + poolId);
    }
}
