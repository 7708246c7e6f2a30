package com.agentvm.core.health;

import com.agentvm.machine.VirtualizationBackend;
import com.agentvm.pool.PoolState;
import com.agentvm.pool.PoolStats;
import com.agentvm.pool.VmPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final VmPool vmPool;
    private final VirtualizationBackend backend;

    public HealthCheckService(
            @Autowired(required = false) VmPool vmPool,
            @Autowired(required = false) VirtualizationBackend backend) {
        this.vmPool = vmPool;
        this.backend = backend;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkPool());
        results.add(checkBackend());
        return results;
    }

    private HealthStatus checkPool() {
        if (vmPool == null) {
            return new HealthStatus("pool", HealthStatus.Status.DOWN,
                    "No VM pool configured", Map.of());
        }
        try {
            PoolStats stats = vmPool.stats();
            var metadata = Map.of(
                    "available", String.valueOf(stats.available()),
                    "checkedOut", String.valueOf(stats.checkedOut()),
                    "creating", String.valueOf(stats.creating()),
                    "minSize", String.valueOf(stats.minSize()));
            if (stats.state() != PoolState.READY) {
                return new HealthStatus("pool", HealthStatus.Status.DOWN,
                        "Pool " + stats.poolId() + " is " + stats.state(), metadata);
            }
            if (stats.available() < stats.minSize()) {
                return new HealthStatus("pool", HealthStatus.Status.DEGRADED,
                        "Pool " + stats.poolId() + " below minimum: " + stats.available() + "/" + stats.minSize()
                                + " available", metadata);
            }
            return new HealthStatus("pool", HealthStatus.Status.UP,
                    "Pool " + stats.poolId() + " ready with " + stats.available() + " machines", metadata);
        } catch (Exception e) {
            log.warn("Pool health check failed: {}", e.getMessage());
            return new HealthStatus("pool", HealthStatus.Status.DOWN,
                    "Pool error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkBackend() {
        if (backend == null) {
            return new HealthStatus("backend", HealthStatus.Status.DOWN,
                    "No VirtualizationBackend configured", Map.of());
        }
        return new HealthStatus("backend", HealthStatus.Status.UP,
                "VirtualizationBackend available (" + backend.getClass().getSimpleName() + ")",
                Map.of());
    }
}
