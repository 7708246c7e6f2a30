package com.agentvm.machine;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Snapshot store keyed by machine uuid. Restores put the machine in {@link #restoredState}.
 */
public class FakeSnapshotService implements SnapshotService {

    private final Map<String, List<SnapshotId>> snapshots = new ConcurrentHashMap<>();
    private final Set<String> failingRestores = ConcurrentHashMap.newKeySet();
    private final AtomicInteger restores = new AtomicInteger();
    private volatile MachineState restoredState = MachineState.RUNNING;

    @Override
    public SnapshotId createSnapshot(MachineHandle machine, String name, String description) {
        var id = new SnapshotId(name);
        snapshots.computeIfAbsent(machine.uuid(), k -> new CopyOnWriteArrayList<>()).add(id);
        return id;
    }

    @Override
    public void restoreSnapshot(MachineHandle machine, SnapshotId snapshotId) {
        if (failingRestores.contains(machine.name())) {
            throw new SnapshotException("Failed to restore snapshot " + snapshotId + " on " + machine.name());
        }
        restores.incrementAndGet();
        if (machine instanceof FakeMachineHandle fake) {
            fake.setState(restoredState);
        }
    }

    @Override
    public List<SnapshotId> listSnapshots(MachineHandle machine) {
        return List.copyOf(snapshots.getOrDefault(machine.uuid(), List.of()));
    }

    public void failRestoreFor(String machineName) {
        failingRestores.add(machineName);
    }

    public void forgetSnapshots(MachineHandle machine) {
        snapshots.remove(machine.uuid());
    }

    public void setRestoredState(MachineState restoredState) {
        this.restoredState = restoredState;
    }

    public int restoreCount() {
        return restores.get();
    }
}
