package com.agentvm.core.health;

import com.agentvm.pool.PoolState;
import com.agentvm.pool.VmPool;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the VM pool.
 * <p>
 * Reports UP when the pool is ready with at least {@code minSize} machines available,
 * DEGRADED when it is ready but running low, and DOWN when it is not ready.
 */
@Component("vmPoolHealthIndicator")
public class VmPoolHealthIndicator implements HealthIndicator {

    private final VmPool vmPool;

    public VmPoolHealthIndicator(@Autowired(required = false) VmPool vmPool) {
        this.vmPool = vmPool;
    }

    @Override
    public Health health() {
        if (vmPool == null) {
            return Health.unknown().withDetail("reason", "pool not enabled").build();
        }

        var stats = vmPool.stats();
        var builder = (stats.state() == PoolState.READY ? Health.up() : Health.down())
                .withDetail("pool.id", stats.poolId())
                .withDetail("pool.state", stats.state().name())
                .withDetail("pool.available", stats.available())
                .withDetail("pool.checkedOut", stats.checkedOut())
                .withDetail("pool.creating", stats.creating())
                .withDetail("pool.acquisitions", stats.acquisitions());

        if (stats.state() == PoolState.READY && stats.available() < stats.minSize()) {
            return builder.status("DEGRADED").build();
        }
        return builder.build();
    }
}
