package com.agentvm.pool;

import com.agentvm.core.events.EventBus;
import com.agentvm.core.events.PoolEvent;
import com.agentvm.core.logging.MdcContext;
import com.agentvm.core.metrics.PoolMetrics;
import com.agentvm.machine.MachineHandle;
import com.agentvm.machine.MachineState;
import com.agentvm.machine.MachineTemplate;
import com.agentvm.machine.SnapshotId;
import com.agentvm.machine.SnapshotService;
import com.agentvm.machine.StateWaiter;
import com.agentvm.machine.VirtualizationBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pool of pre-warmed virtual machines.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Boots {@code minSize} machines in parallel on {@link #initialize()}</li>
 *   <li>Hands out ready machines from {@link #acquire(Duration)} without a boot wait</li>
 *   <li>Resets released machines to their golden snapshot and re-queues them, or destroys them
 *       when the reset fails or the pool is full</li>
 *   <li>Runs a maintenance worker that evicts machines past their TTL and refills to {@code minSize}</li>
 * </ul>
 *
 * <p>The available set, the checked-out map and the in-flight creation count are the only
 * shared mutable state. Every mutation happens under {@link #lock}, so a machine is never
 * handed to two callers. Backend calls (boot, reset, destroy) run outside the lock.
 *
 * <p>A creation that completes after every waiter gave up is still enqueued by the task that
 * created it, or destroyed when there is no room for it.
 */
public class VmPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(VmPool.class);

    private static final DateTimeFormatter NAME_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private final String poolId;
    private final VirtualizationBackend backend;
    private final SnapshotService snapshots;
    private final StateWaiter stateWaiter;
    private final PoolProperties properties;
    private final EventBus eventBus;
    private final PoolMetrics metrics;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition machineAvailable = lock.newCondition();
    private final Deque<PooledMachine> available = new ArrayDeque<>();
    private final Map<String, PooledMachine> checkedOut = new HashMap<>();
    private int creating;
    private PoolState state = PoolState.UNINITIALIZED;
    private long acquisitions;
    private long totalAcquisitionNanos;

    private final AtomicInteger sequence = new AtomicInteger();
    private final ExecutorService creationExecutor;
    private final ScheduledExecutorService maintenance;

    public VmPool(VirtualizationBackend backend, SnapshotService snapshots, StateWaiter stateWaiter,
                  PoolProperties properties, EventBus eventBus, PoolMetrics metrics) {
        this(backend, snapshots, stateWaiter, properties, eventBus, metrics, Clock.systemUTC());
    }

    VmPool(VirtualizationBackend backend, SnapshotService snapshots, StateWaiter stateWaiter,
           PoolProperties properties, EventBus eventBus, PoolMetrics metrics, Clock clock) {
        validate(properties);
        this.poolId = properties.getId();
        this.backend = backend;
        this.snapshots = snapshots;
        this.stateWaiter = stateWaiter;
        this.properties = properties;
        this.eventBus = eventBus != null ? eventBus : new EventBus();
        this.metrics = metrics;
        this.clock = clock;

        var creatorCount = new AtomicInteger();
        // one thread per in-flight creation; a batch never waits on another's boot
        this.creationExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "vm-pool-" + poolId + "-create-" + creatorCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.maintenance = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "vm-pool-" + poolId + "-maintenance");
            t.setDaemon(true);
            return t;
        });
    }

    private static void validate(PoolProperties properties) {
        if (properties.getMinSize() < 0) {
            throw new VmPoolException("minSize cannot be negative");
        }
        if (properties.getMaxSize() < 1) {
            throw new VmPoolException("maxSize must be at least 1");
        }
        if (properties.getMinSize() > properties.getMaxSize()) {
            throw new VmPoolException("minSize cannot exceed maxSize");
        }
        if (properties.getTtl().isNegative() || properties.getTtl().isZero()) {
            throw new VmPoolException("ttl must be positive");
        }
        if (properties.getMaintenanceInterval().isNegative() || properties.getMaintenanceInterval().isZero()) {
            throw new VmPoolException("maintenance interval must be positive");
        }
        if (properties.getStatePollCeiling().compareTo(Duration.ofMillis(1)) < 0) {
            throw new VmPoolException("state poll ceiling must be at least 1ms");
        }
    }

    // -- Lifecycle --------------------------------------------------------------

    /**
     * Boots {@code minSize} machines concurrently, enqueues every one that came up, and starts
     * the maintenance worker. Individual creation failures are logged and do not abort the
     * others; the next maintenance cycle backfills them. Does nothing if already initialized.
     *
     * @return number of machines that were created
     * @throws VmPoolException when the pool was already shut down
     */
    public int initialize() {
        lock.lock();
        try {
            if (state == PoolState.READY || state == PoolState.INITIALIZING) {
                log.debug("Pool {} already initialized", poolId);
                return 0;
            }
            if (state != PoolState.UNINITIALIZED) {
                throw new VmPoolException("Cannot initialize pool " + poolId + " in state " + state);
            }
            state = PoolState.INITIALIZING;
            creating += properties.getMinSize();
        } finally {
            lock.unlock();
        }

        MdcContext.setPool(poolId);
        try {
            log.info("Initializing pool {} with {} machines (max {})",
                    poolId, properties.getMinSize(), properties.getMaxSize());
            long startMs = System.currentTimeMillis();
            int created = createBatch(properties.getMinSize());

            boolean ready;
            lock.lock();
            try {
                if (state == PoolState.INITIALIZING) {
                    state = PoolState.READY;
                }
                ready = state == PoolState.READY;
                if (ready) {
                    long intervalMs = properties.getMaintenanceInterval().toMillis();
                    maintenance.scheduleWithFixedDelay(this::runMaintenance, intervalMs, intervalMs,
                            TimeUnit.MILLISECONDS);
                }
            } finally {
                lock.unlock();
            }
            if (!ready) {
                log.info("Pool {} was shut down during initialization; {} machines created", poolId, created);
                return created;
            }

            log.info("Pool {} ready: {}/{} machines created in {}ms",
                    poolId, created, properties.getMinSize(), System.currentTimeMillis() - startMs);
            publish("pool.ready", null, Map.of("created", created, "requested", properties.getMinSize()));
            return created;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Stops maintenance, wakes every waiting {@code acquire}, and destroys all available machines.
     * Machines still checked out are destroyed when they are released. Idempotent.
     */
    public void shutdown() {
        List<PooledMachine> drained;
        int stillCheckedOut;
        lock.lock();
        try {
            if (state == PoolState.DRAINING || state == PoolState.SHUTDOWN) {
                return;
            }
            state = PoolState.DRAINING;
            drained = new ArrayList<>(available);
            available.clear();
            stillCheckedOut = checkedOut.size();
            machineAvailable.signalAll();
        } finally {
            lock.unlock();
        }

        log.info("Shutting down pool {}: destroying {} available machines ({} still checked out)",
                poolId, drained.size(), stillCheckedOut);
        maintenance.shutdownNow();
        for (PooledMachine machine : drained) {
            destroy(machine, "pool shutdown");
        }

        // in-flight creations finish and destroy their machines when they see DRAINING
        creationExecutor.shutdown();
        try {
            long waitMs = properties.getBootTimeout().plus(properties.getDestroyTimeout()).toMillis();
            if (!creationExecutor.awaitTermination(waitMs, TimeUnit.MILLISECONDS)) {
                log.warn("Pool {} creation tasks did not finish in {}ms", poolId, waitMs);
                creationExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            creationExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        lock.lock();
        try {
            state = PoolState.SHUTDOWN;
        } finally {
            lock.unlock();
        }
        log.info("Pool {} shut down", poolId);
        publish("pool.shutdown", null, Map.of("destroyed", drained.size()));
    }

    @Override
    public void close() {
        shutdown();
    }

    // -- Acquire / release ------------------------------------------------------

    /**
     * Removes a ready machine from the pool and hands it to the caller.
     *
     * <p>Returns immediately when a machine is available. Machines found past their TTL are
     * destroyed instead of returned. Otherwise waits until maintenance or a release supplies
     * one. With on-demand creation enabled, the caller's thread boots a fresh machine instead
     * of waiting; that machine joins the pool on release like any other.
     *
     * @param timeout how long to wait for a machine
     * @return a machine checked out exclusively to the caller
     * @throws PoolExhaustedException when no machine became available in time
     * @throws VmPoolException        when the pool is not ready or on-demand creation failed
     */
    public PooledMachine acquire(Duration timeout) {
        long startNanos = System.nanoTime();
        long deadlineNanos = startNanos + timeout.toNanos();
        var expired = new ArrayList<PooledMachine>();
        PooledMachine acquired = null;
        boolean createOnDemand = false;

        lock.lock();
        try {
            ensureReady();
            while (acquired == null) {
                PooledMachine head = available.pollFirst();
                if (head != null) {
                    if (head.isOlderThan(properties.getTtl(), clock.instant())) {
                        expired.add(head);
                        continue;
                    }
                    checkedOut.put(head.uuid(), head);
                    acquired = head;
                    acquisitions++;
                    totalAcquisitionNanos += System.nanoTime() - startNanos;
                    break;
                }
                if (properties.isOnDemandCreation()) {
                    createOnDemand = true;
                    break;
                }
                long remaining = deadlineNanos - System.nanoTime();
                if (remaining <= 0) {
                    break;
                }
                machineAvailable.awaitNanos(remaining);
                ensureReady();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VmPoolException("Interrupted while acquiring from pool " + poolId, e);
        } finally {
            lock.unlock();
            for (PooledMachine machine : expired) {
                evict(machine);
            }
        }

        if (acquired == null && createOnDemand) {
            acquired = acquireOnDemand(startNanos);
        }
        if (acquired == null) {
            log.warn("Pool {} exhausted after {}ms", poolId, timeout.toMillis());
            if (metrics != null) {
                metrics.recordExhausted();
            }
            throw new PoolExhaustedException(poolId, timeout);
        }

        Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);
        if (metrics != null) {
            metrics.recordAcquisition(latency);
        }
        log.info("Acquired {} from pool {} in {}ms", acquired.name(), poolId, latency.toMillis());
        publish("machine.acquired", acquired.name(), Map.of("latencyMs", latency.toMillis()));
        return acquired;
    }

    /**
     * Returns a machine to the pool.
     *
     * <p>The machine is restored to its golden snapshot first. On success it is re-queued, or
     * destroyed when the pool already holds {@code maxSize} machines. When the reset fails the
     * machine is destroyed rather than returned in an unknown state; the failure is logged and
     * published as {@code machine.reset_failed} and reported through the returned outcome.
     *
     * @throws UnknownMachineException when the machine is not checked out from this pool
     */
    public ReleaseOutcome release(PooledMachine machine) {
        PooledMachine owned;
        boolean active;
        lock.lock();
        try {
            owned = checkedOut.remove(machine.uuid());
            if (owned == null) {
                throw new UnknownMachineException(poolId, machine.name());
            }
            active = state == PoolState.READY || state == PoolState.INITIALIZING;
        } finally {
            lock.unlock();
        }

        MdcContext.setMachine(poolId, owned.name());
        try {
            if (!active) {
                destroy(owned, "released after shutdown");
                return finishRelease(owned, ReleaseOutcome.DESTROYED_SHUTDOWN);
            }

            try {
                resetToGolden(owned);
            } catch (ResetFailureException e) {
                log.error("Reset of {} failed; destroying it instead of returning it to pool {}",
                        owned.name(), poolId, e);
                if (metrics != null) {
                    metrics.recordResetFailure();
                }
                publish("machine.reset_failed", owned.name(), Map.of(
                        "snapshot", owned.goldenSnapshotId().value(),
                        "error", String.valueOf(e.getMessage())));
                destroy(owned, "reset failed");
                return finishRelease(owned, ReleaseOutcome.DESTROYED_RESET_FAILED);
            }

            ReleaseOutcome outcome;
            lock.lock();
            try {
                if (state != PoolState.READY && state != PoolState.INITIALIZING) {
                    outcome = ReleaseOutcome.DESTROYED_SHUTDOWN;
                } else if (available.size() >= properties.getMaxSize()) {
                    outcome = ReleaseOutcome.DESTROYED_POOL_FULL;
                } else {
                    available.addLast(owned);
                    machineAvailable.signal();
                    outcome = ReleaseOutcome.RETURNED;
                }
            } finally {
                lock.unlock();
            }

            if (outcome != ReleaseOutcome.RETURNED) {
                destroy(owned, outcome == ReleaseOutcome.DESTROYED_POOL_FULL ? "pool full" : "released after shutdown");
            }
            return finishRelease(owned, outcome);
        } finally {
            MdcContext.clear();
        }
    }

    private ReleaseOutcome finishRelease(PooledMachine machine, ReleaseOutcome outcome) {
        if (metrics != null) {
            metrics.recordRelease(outcome.metricTag());
        }
        log.info("Released {} to pool {}: {}", machine.name(), poolId, outcome);
        publish("machine.released", machine.name(), Map.of("outcome", outcome.name()));
        return outcome;
    }

    // -- Maintenance ------------------------------------------------------------

    /**
     * One maintenance cycle: evicts available machines older than the TTL, then creates enough
     * machines in parallel to bring the pool back to {@code minSize} (never beyond
     * {@code maxSize}). Checked-out machines are never touched. Failures are logged and retried
     * on the next cycle. Runs on the maintenance worker, and may also be invoked directly to
     * backfill after a partial {@link #initialize()}.
     */
    public void runMaintenance() {
        MdcContext.setPool(poolId);
        try {
            if (getState() != PoolState.READY) {
                return;
            }
            evictExpired();

            int needed;
            int current;
            lock.lock();
            try {
                current = available.size();
                int pending = current + creating;
                needed = Math.min(properties.getMinSize() - pending, properties.getMaxSize() - pending);
                if (needed <= 0 || state != PoolState.READY) {
                    return;
                }
                creating += needed;
            } finally {
                lock.unlock();
            }

            log.info("Refilling pool {}: {} available, creating {}", poolId, current, needed);
            int created = createBatch(needed);
            if (created < needed) {
                log.warn("Pool {} refill created {}/{} machines; retrying next cycle", poolId, created, needed);
            }
        } catch (RuntimeException e) {
            log.error("Pool {} maintenance cycle failed", poolId, e);
        } finally {
            MdcContext.clear();
        }
    }

    private void evictExpired() {
        var expired = new ArrayList<PooledMachine>();
        Instant now = clock.instant();
        lock.lock();
        try {
            Iterator<PooledMachine> it = available.iterator();
            while (it.hasNext()) {
                PooledMachine machine = it.next();
                if (machine.isOlderThan(properties.getTtl(), now)) {
                    it.remove();
                    expired.add(machine);
                }
            }
        } finally {
            lock.unlock();
        }
        for (PooledMachine machine : expired) {
            evict(machine);
        }
    }

    private void evict(PooledMachine machine) {
        log.info("Evicting {} from pool {}: age {}s exceeds TTL {}s", machine.name(), poolId,
                machine.age(clock.instant()).toSeconds(), properties.getTtl().toSeconds());
        if (metrics != null) {
            metrics.recordEviction();
        }
        publish("machine.evicted", machine.name(), Map.of("ageSeconds", machine.age(clock.instant()).toSeconds()));
        destroy(machine, "ttl expired");
    }

    // -- Creation ---------------------------------------------------------------

    /**
     * Launches {@code count} creations concurrently and waits for the whole batch. The caller
     * must already have added {@code count} to {@link #creating}. Each creation enqueues its own
     * machine, so completion order does not matter.
     *
     * @return number of machines that came up
     */
    private int createBatch(int count) {
        var futures = new ArrayList<CompletableFuture<Boolean>>();
        for (int i = 0; i < count; i++) {
            CompletableFuture<PooledMachine> creation;
            try {
                creation = CompletableFuture.supplyAsync(this::createMachine, creationExecutor);
            } catch (RejectedExecutionException e) {
                creation = CompletableFuture.failedFuture(
                        new VmPoolException("Pool " + poolId + " is shutting down; creation not started"));
            }
            futures.add(creation.handle((machine, failure) -> {
                if (failure != null) {
                    onCreationFailed(failure);
                    return false;
                }
                return enqueueCreated(machine);
            }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return (int) futures.stream().filter(CompletableFuture::join).count();
    }

    private boolean enqueueCreated(PooledMachine machine) {
        boolean accepted;
        lock.lock();
        try {
            creating--;
            boolean active = state == PoolState.READY || state == PoolState.INITIALIZING;
            accepted = active && available.size() < properties.getMaxSize();
            if (accepted) {
                available.addLast(machine);
                machineAvailable.signal();
            }
        } finally {
            lock.unlock();
        }
        if (!accepted) {
            log.info("No room for new machine {} in pool {}; destroying it", machine.name(), poolId);
            destroy(machine, "no room after creation");
        }
        return accepted;
    }

    private void onCreationFailed(Throwable failure) {
        lock.lock();
        try {
            creating--;
        } finally {
            lock.unlock();
        }
        Throwable cause = failure.getCause() != null ? failure.getCause() : failure;
        log.error("Machine creation for pool {} failed: {}", poolId, cause.getMessage(), cause);
        publish("machine.creation_failed", null, Map.of("error", String.valueOf(cause.getMessage())));
    }

    private PooledMachine acquireOnDemand(long startNanos) {
        log.warn("Pool {} empty; creating a machine on demand", poolId);
        PooledMachine machine = createMachine();
        boolean accepted;
        lock.lock();
        try {
            accepted = state == PoolState.READY;
            if (accepted) {
                checkedOut.put(machine.uuid(), machine);
                acquisitions++;
                totalAcquisitionNanos += System.nanoTime() - startNanos;
            }
        } finally {
            lock.unlock();
        }
        if (!accepted) {
            destroy(machine, "pool shut down during on-demand creation");
            throw new VmPoolException("Pool " + poolId + " shut down during on-demand creation");
        }
        return machine;
    }

    /**
     * Defines, boots and snapshots one machine. Any failure destroys the half-built machine.
     */
    private PooledMachine createMachine() {
        String name = properties.getNamePrefix() + "-" + sequence.incrementAndGet()
                + "-" + NAME_TIMESTAMP.format(clock.instant());
        MdcContext.setMachine(poolId, name);
        long startMs = System.currentTimeMillis();
        MachineHandle handle = null;
        try {
            handle = backend.createMachine(new MachineTemplate(name,
                    properties.getResourceProfile(), properties.getNetworkMode()));
            handle.start();
            stateWaiter.waitForState(handle, MachineState.RUNNING, properties.getBootTimeout(),
                    properties.getStatePollCeiling());
            SnapshotId golden = snapshots.createSnapshot(handle, name + "-golden", "Golden state for pool reset");

            long elapsedMs = System.currentTimeMillis() - startMs;
            if (metrics != null) {
                metrics.recordCreation(true, elapsedMs);
            }
            log.info("Created {} (snapshot {}) in {}ms", name, golden, elapsedMs);
            publish("machine.created", name, Map.of("snapshot", golden.value(), "elapsedMs", elapsedMs));
            return new PooledMachine(handle, clock.instant(), golden);
        } catch (RuntimeException e) {
            if (metrics != null) {
                metrics.recordCreation(false, System.currentTimeMillis() - startMs);
            }
            if (handle != null) {
                destroyHandle(handle, "creation failed");
            }
            throw new VmPoolException("Failed to create machine " + name + ": " + e.getMessage(), e);
        } finally {
            MdcContext.clear();
        }
    }

    // -- Reset / destroy --------------------------------------------------------

    private void resetToGolden(PooledMachine machine) {
        MachineHandle handle = machine.handle();
        SnapshotId golden = machine.goldenSnapshotId();
        try {
            if (!snapshots.listSnapshots(handle).contains(golden)) {
                throw new ResetFailureException(machine.name(), "golden snapshot " + golden + " no longer exists");
            }
            snapshots.restoreSnapshot(handle, golden);
            if (handle.getState().isTerminal()) {
                handle.start();
            }
            stateWaiter.waitForState(handle, MachineState.RUNNING, properties.getResetTimeout(),
                    properties.getStatePollCeiling());
            log.debug("Reset {} to {}", machine.name(), golden);
        } catch (ResetFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ResetFailureException(machine.name(), e);
        }
    }

    private void destroy(PooledMachine machine, String reason) {
        destroyHandle(machine.handle(), reason);
    }

    /**
     * Powers off and destroys a machine. Failures are logged and the machine is dropped from
     * bookkeeping regardless, so a broken backend cannot leak pool slots.
     */
    private void destroyHandle(MachineHandle handle, String reason) {
        try {
            if (handle.getState() != MachineState.STOPPED) {
                handle.stop(false);
                stateWaiter.waitForState(handle, MachineState.STOPPED, properties.getDestroyTimeout(),
                        properties.getStatePollCeiling());
            }
        } catch (RuntimeException e) {
            log.warn("Could not stop {} cleanly ({}): {}", handle.name(), reason, e.getMessage());
        }
        try {
            handle.destroy();
            log.info("Destroyed {} ({})", handle.name(), reason);
            publish("machine.destroyed", handle.name(), Map.of("reason", reason));
        } catch (RuntimeException e) {
            log.warn("Backend cleanup of {} failed ({}); dropping it from pool {} anyway",
                    handle.name(), reason, poolId, e);
        }
    }

    // -- Introspection ----------------------------------------------------------

    public String getPoolId() {
        return poolId;
    }

    public PoolState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of machines ready to be acquired
     */
    public int size() {
        lock.lock();
        try {
            return available.size();
        } finally {
            lock.unlock();
        }
    }

    public PoolStats stats() {
        lock.lock();
        try {
            double avgMs = acquisitions == 0 ? 0.0
                    : (double) totalAcquisitionNanos / acquisitions / 1_000_000.0;
            return new PoolStats(poolId, state, available.size(), checkedOut.size(), creating,
                    properties.getMinSize(), properties.getMaxSize(), acquisitions, avgMs);
        } finally {
            lock.unlock();
        }
    }

    private void ensureReady() {
        if (state != PoolState.READY) {
            throw new VmPoolException("Pool " + poolId + " is not ready (state " + state + ")");
        }
    }

    private void publish(String eventType, String machineName, Map<String, Object> payload) {
        eventBus.publish(PoolEvent.of(eventType, poolId, machineName, payload));
    }
}
