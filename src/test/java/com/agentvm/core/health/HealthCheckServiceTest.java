package com.agentvm.core.health;

import com.agentvm.machine.VirtualizationBackend;
import com.agentvm.pool.PoolState;
import com.agentvm.pool.PoolStats;
import com.agentvm.pool.VmPool;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    private static PoolStats stats(PoolState state, int available, int minSize) {
        return new PoolStats("default", state, available, 0, 0, minSize, 10, 0, 0.0);
    }

    private static HealthStatus component(List<HealthStatus> results, String name) {
        return results.stream().filter(s -> name.equals(s.component())).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("All components null -> all DOWN")
    void allComponentsNullAllDown() {
        var service = new HealthCheckService(null, null);
        List<HealthStatus> results = service.checkAll();

        assertEquals(2, results.size());
        for (var status : results) {
            assertEquals(HealthStatus.Status.DOWN, status.status(),
                    status.component() + " should be DOWN when null");
        }
    }

    @Test
    @DisplayName("Ready pool at minimum -> pool UP")
    void readyPoolUp() {
        var pool = mock(VmPool.class);
        when(pool.stats()).thenReturn(stats(PoolState.READY, 5, 5));

        var status = component(new HealthCheckService(pool, null).checkAll(), "pool");
        assertEquals(HealthStatus.Status.UP, status.status());
        assertEquals("5", status.metadata().get("available"));
    }

    @Test
    @DisplayName("Ready pool below minimum -> pool DEGRADED")
    void lowPoolDegraded() {
        var pool = mock(VmPool.class);
        when(pool.stats()).thenReturn(stats(PoolState.READY, 1, 5));

        assertEquals(HealthStatus.Status.DEGRADED,
                component(new HealthCheckService(pool, null).checkAll(), "pool").status());
    }

    @Test
    @DisplayName("Draining pool -> pool DOWN")
    void drainingPoolDown() {
        var pool = mock(VmPool.class);
        when(pool.stats()).thenReturn(stats(PoolState.DRAINING, 0, 5));

        assertEquals(HealthStatus.Status.DOWN,
                component(new HealthCheckService(pool, null).checkAll(), "pool").status());
    }

    @Test
    @DisplayName("Backend present -> backend UP")
    void backendUp() {
        var service = new HealthCheckService(null, mock(VirtualizationBackend.class));
        assertEquals(HealthStatus.Status.UP, component(service.checkAll(), "backend").status());
    }
}
