package com.agentvm.pool;

import com.agentvm.machine.NetworkMode;
import com.agentvm.machine.ResourceProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PoolPropertiesTest {

    @Test
    @DisplayName("defaults match the documented pool and machine settings")
    void defaults() {
        var props = new PoolProperties();

        assertEquals(5, props.getMinSize());
        assertEquals(20, props.getMaxSize());
        assertEquals(Duration.ofHours(1), props.getTtl());
        assertEquals(Duration.ofSeconds(10), props.getMaintenanceInterval());
        assertEquals(Duration.ofSeconds(30), props.getBootTimeout());
        assertEquals(Duration.ofMillis(500), props.getStatePollCeiling());
        assertFalse(props.isOnDemandCreation());
        assertEquals(ResourceProfile.STANDARD, props.getResourceProfile());
        assertEquals(NetworkMode.NAT_FILTERED, props.getNetworkMode());
    }

    @Test
    @DisplayName("nested setters feed the delegate getters")
    void nestedSetters() {
        var props = new PoolProperties();
        props.getPool().setTtlSeconds(90);
        props.getMachine().setMemoryMib(4096);

        assertEquals(Duration.ofSeconds(90), props.getTtl());
        assertEquals(4096, props.getResourceProfile().memoryMib());
    }

    @Test
    @DisplayName("a pooled machine is stale only once its age exceeds the TTL")
    void pooledMachineAge() {
        var created = Instant.parse("2026-01-01T00:00:00Z");
        var machine = new PooledMachine(null, created, null);

        assertFalse(machine.isOlderThan(Duration.ofSeconds(60), created.plusSeconds(60)));
        assertTrue(machine.isOlderThan(Duration.ofSeconds(60), created.plusSeconds(61)));
        assertEquals(Duration.ofSeconds(30), machine.age(created.plusSeconds(30)));
    }
}
