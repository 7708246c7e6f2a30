package com.agentvm.machine;

/**
 * Observed lifecycle state of a virtual machine, as reported by the virtualization backend.
 */
public enum MachineState {
    CREATING,
    RUNNING,
    PAUSED,
    SHUTTING_DOWN,
    STOPPED,
    CRASHED,
    UNKNOWN;

    /**
     * True for states from which the machine will not reach RUNNING on its own.
     */
    public boolean isTerminal() {
        return this == STOPPED || this == CRASHED;
    }
}
