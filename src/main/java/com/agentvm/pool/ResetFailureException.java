package com.agentvm.pool;

/**
 * A machine could not be restored to its golden snapshot. The pool destroys such machines
 * instead of returning them in an unknown state.
 */
public class ResetFailureException extends VmPoolException {

    private final String machineName;

    public ResetFailureException(String machineName, String reason) {
        super("Failed to reset " + machineName + " to golden state: " + reason);
        this.machineName = machineName;
    }

    public ResetFailureException(String machineName, Throwable cause) {
        super("Failed to reset " + machineName + " to golden state: " + cause.getMessage(), cause);
        this.machineName = machineName;
    }

    public String getMachineName() {
        return machineName;
    }
}
