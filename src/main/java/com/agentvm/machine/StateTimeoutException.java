package com.agentvm.machine;

import java.time.Duration;

/**
 * Thrown when a machine does not reach the expected state before the deadline.
 * Carries the last state that was observed so callers can decide whether to force-destroy.
 */
public class StateTimeoutException extends MachineException {

    private final MachineState targetState;
    private final MachineState lastObservedState;
    private final Duration timeout;

    public StateTimeoutException(String machineName, MachineState targetState,
                                 MachineState lastObservedState, Duration timeout) {
        super("Timeout waiting for " + machineName + " to reach " + targetState
                + " (current: " + lastObservedState + ", timeout: " + timeout.toMillis() + "ms)");
        this.targetState = targetState;
        this.lastObservedState = lastObservedState;
        this.timeout = timeout;
    }

    public MachineState getTargetState() { return targetState; }
    public MachineState getLastObservedState() { return lastObservedState; }
    public Duration getTimeout() { return timeout; }
}
