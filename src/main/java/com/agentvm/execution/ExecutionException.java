package com.agentvm.execution;

/**
 * Thrown when agent code cannot be run to completion in a guest: the guest reported an error,
 * the deadline passed, the channel failed, or the result could not be read.
 */
public class ExecutionException extends RuntimeException {

    public ExecutionException(String message) {
        super(message);
    }

    public ExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
