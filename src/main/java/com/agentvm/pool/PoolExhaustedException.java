package com.agentvm.pool;

import java.time.Duration;

/**
 * No machine became available before the acquire timeout. Signals backpressure: retry later.
 */
public class PoolExhaustedException extends VmPoolException {

    private final Duration timeout;

    public PoolExhaustedException(String poolId, Duration timeout) {
        super("Pool " + poolId + " exhausted: no machine available within "
                + timeout.toMillis() + "ms, retry later");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
