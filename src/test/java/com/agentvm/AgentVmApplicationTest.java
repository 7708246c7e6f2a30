package com.agentvm;

import com.agentvm.channel.ChannelProperties;
import com.agentvm.core.health.HealthCheckService;
import com.agentvm.execution.AgentExecutor;
import com.agentvm.machine.StateWaiter;
import com.agentvm.pool.PoolProperties;
import com.agentvm.pool.VmPool;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "spring.main.web-application-type=none",
        "agentvm.pool.min-size=2",
        "agentvm.channel.max-payload-bytes=4096"
})
class AgentVmApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private PoolProperties poolProperties;

    @Autowired
    private ChannelProperties channelProperties;

    @Test
    @DisplayName("context starts without a pool when none is enabled")
    void contextLoads() {
        assertTrue(context.getBeansOfType(VmPool.class).isEmpty());
        assertNotNull(context.getBean(HealthCheckService.class));
        assertNotNull(context.getBean(AgentExecutor.class));
        assertNotNull(context.getBean(StateWaiter.class));
    }

    @Test
    @DisplayName("configuration binds from properties")
    void bindsProperties() {
        assertEquals(2, poolProperties.getMinSize());
        assertEquals(Duration.ofSeconds(10), poolProperties.getMaintenanceInterval());
        assertEquals(4096, channelProperties.getMaxPayloadBytes());
    }
}
