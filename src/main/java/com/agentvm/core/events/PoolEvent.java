package com.agentvm.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A lifecycle event emitted by a VM pool.
 *
 * @param eventType   event type (e.g. "machine.created", "machine.reset_failed", "pool.ready")
 * @param poolId      the pool this event belongs to
 * @param machineName the machine this event relates to (nullable for pool-level events)
 * @param payload     arbitrary key-value data associated with the event
 * @param timestamp   when the event occurred
 */
public record PoolEvent(
    String eventType,
    String poolId,
    String machineName,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static PoolEvent of(String eventType, String poolId, String machineName, Map<String, Object> payload) {
        return new PoolEvent(eventType, poolId, machineName, payload, Instant.now());
    }
}
