package com.agentvm.machine;

import java.util.List;

/**
 * Snapshot capability of the virtualization backend.
 * Used by the pool to capture a golden state per machine and to reset machines before reuse.
 */
public interface SnapshotService {

    /**
     * Captures the current state of the machine.
     *
     * @param machine     machine to snapshot
     * @param name        snapshot name, unique per machine
     * @param description free-form description stored with the snapshot
     * @return identity of the new snapshot
     * @throws SnapshotException when the snapshot cannot be taken
     */
    SnapshotId createSnapshot(MachineHandle machine, String name, String description);

    /**
     * Reverts the machine to the given snapshot.
     * @throws SnapshotException when the restore fails
     */
    void restoreSnapshot(MachineHandle machine, SnapshotId snapshotId);

    /**
     * @return every snapshot currently defined for the machine
     * @throws SnapshotException when the backend cannot list snapshots
     */
    List<SnapshotId> listSnapshots(MachineHandle machine);
}
