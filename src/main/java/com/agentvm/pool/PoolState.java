package com.agentvm.pool;

/**
 * Lifecycle of a {@link VmPool}: UNINITIALIZED, INITIALIZING, READY, DRAINING, SHUTDOWN.
 */
public enum PoolState {
    UNINITIALIZED,
    INITIALIZING,
    READY,
    DRAINING,
    SHUTDOWN
}
