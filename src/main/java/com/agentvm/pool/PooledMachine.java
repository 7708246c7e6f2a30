package com.agentvm.pool;

import com.agentvm.machine.MachineHandle;
import com.agentvm.machine.SnapshotId;

import java.time.Duration;
import java.time.Instant;

/**
 * A machine owned by a {@link VmPool}, with the bookkeeping needed to recycle it.
 *
 * @param handle           the backend machine; owned exclusively by the pool or one caller
 * @param createdAt        when the machine finished its first boot, used for TTL eviction
 * @param goldenSnapshotId snapshot the machine is restored to on release
 */
public record PooledMachine(MachineHandle handle, Instant createdAt, SnapshotId goldenSnapshotId) {

    public String name() {
        return handle.name();
    }

    public String uuid() {
        return handle.uuid();
    }

    public Duration age(Instant now) {
        return Duration.between(createdAt, now);
    }

    public boolean isOlderThan(Duration ttl, Instant now) {
        return age(now).compareTo(ttl) > 0;
    }
}
