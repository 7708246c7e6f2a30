package com.agentvm.machine;

/**
 * Backend-owned identity of a machine snapshot.
 */
public record SnapshotId(String value) {

    public SnapshotId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Snapshot id must not be blank");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
