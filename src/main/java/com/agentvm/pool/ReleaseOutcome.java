package com.agentvm.pool;

/**
 * What happened to a machine handed back through {@link VmPool#release(PooledMachine)}.
 */
public enum ReleaseOutcome {
    /** Reset to its golden snapshot and available again. */
    RETURNED,
    /** Reset succeeded but the pool already held {@code maxSize} machines. */
    DESTROYED_POOL_FULL,
    /** The golden snapshot could not be restored; the machine was destroyed. */
    DESTROYED_RESET_FAILED,
    /** The pool is draining or shut down. */
    DESTROYED_SHUTDOWN;

    public String metricTag() {
        return name().toLowerCase();
    }
}
