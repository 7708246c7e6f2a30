package com.agentvm.pool;

/**
 * Thrown when a pool operation cannot be carried out (invalid configuration, wrong state,
 * machine creation failure).
 */
public class VmPoolException extends RuntimeException {
    public VmPoolException(String message) {
        super(message);
    }

    public VmPoolException(String message, Throwable cause) {
        super(message, cause);
    }
}
