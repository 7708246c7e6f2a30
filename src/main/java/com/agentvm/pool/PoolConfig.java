package com.agentvm.pool;

import com.agentvm.core.events.EventBus;
import com.agentvm.core.metrics.PoolMetrics;
import com.agentvm.machine.SnapshotService;
import com.agentvm.machine.StateWaiter;
import com.agentvm.machine.VirtualizationBackend;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PoolConfig {

    @Bean
    public StateWaiter stateWaiter(PoolProperties properties) {
        return new StateWaiter(properties.getStatePollCeiling());
    }

    /**
     * The pool is only wired when enabled; the embedding application supplies the
     * {@link VirtualizationBackend} and {@link SnapshotService} for its hypervisor.
     * Spring boots the pool on startup and drains it on context close.
     */
    @Bean(initMethod = "initialize", destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "agentvm.pool", name = "enabled", havingValue = "true")
    public VmPool vmPool(VirtualizationBackend backend,
                         SnapshotService snapshotService,
                         StateWaiter stateWaiter,
                         PoolProperties properties,
                         EventBus eventBus,
                         @Autowired(required = false) PoolMetrics metrics) {
        return new VmPool(backend, snapshotService, stateWaiter, properties, eventBus, metrics);
    }
}
