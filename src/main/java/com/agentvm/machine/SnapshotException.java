package com.agentvm.machine;

/**
 * Thrown when a snapshot cannot be created, listed or restored.
 */
public class SnapshotException extends RuntimeException {
    public SnapshotException(String message) {
        super(message);
    }

    public SnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
