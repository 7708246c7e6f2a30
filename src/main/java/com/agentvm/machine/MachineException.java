package com.agentvm.machine;

/**
 * Thrown when a machine lifecycle call fails or its state cannot be observed.
 */
public class MachineException extends RuntimeException {
    public MachineException(String message) {
        super(message);
    }

    public MachineException(String message, Throwable cause) {
        super(message, cause);
    }
}
