package com.agentvm.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the VM pool and its control channels.
 */
@Service
public class PoolMetrics {

    private final MeterRegistry registry;

    public PoolMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAcquisition(Duration latency) {
        Timer.builder("agentvm.pool.acquire.duration")
                .description("Time from acquire() call to machine hand-out")
                .register(registry)
                .record(latency);
    }

    public void recordExhausted() {
        Counter.builder("agentvm.pool.exhausted")
                .description("acquire() calls that timed out with no machine available")
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "returned", "destroyed_pool_full", "destroyed_reset_failed" or "destroyed_shutdown"
     */
    public void recordRelease(String outcome) {
        Counter.builder("agentvm.pool.releases")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordCreation(boolean success, long ms) {
        Counter.builder("agentvm.pool.creations")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
        if (success) {
            Timer.builder("agentvm.pool.creation.duration")
                    .register(registry)
                    .record(Duration.ofMillis(ms));
        }
    }

    public void recordEviction() {
        Counter.builder("agentvm.pool.evictions")
                .description("Available machines destroyed for exceeding their TTL")
                .register(registry)
                .increment();
    }

    public void recordResetFailure() {
        Counter.builder("agentvm.pool.reset_failures")
                .register(registry)
                .increment();
    }

    // --- Control channel ---

    /**
     * @param direction "sent" or "received"
     * @param type      message type name
     */
    public void recordFrame(String direction, String type) {
        Counter.builder("agentvm.channel.frames")
                .tag("direction", direction)
                .tag("type", type)
                .register(registry)
                .increment();
    }

    /**
     * @param reason "invalid" (checksum/type) or "oversized"
     */
    public void recordProtocolError(String reason) {
        Counter.builder("agentvm.channel.protocol_errors")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
