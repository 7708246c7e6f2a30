package com.agentvm.machine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Polls a machine until it reports a target state or a deadline passes.
 *
 * <p>Poll delays follow a {@link BackoffSchedule}: 50ms, then doubling up to the poll ceiling
 * (default 500ms). Fast transitions such as a warm boot are detected within a few tens of
 * milliseconds while slow ones (graceful shutdown) cost few backend calls. The last sleep is
 * clipped to the time left, so a failing wait returns no later than
 * {@code timeout + one poll interval}.
 *
 * <p>There are no retries past the deadline; callers decide what to do next
 * (for example force-destroy the machine).
 */
public class StateWaiter {

    private static final Logger log = LoggerFactory.getLogger(StateWaiter.class);

    private final Duration defaultPollCeiling;
    private final Sleeper sleeper;

    public StateWaiter() {
        this(BackoffSchedule.DEFAULT_CEILING, Sleeper.THREAD);
    }

    public StateWaiter(Duration defaultPollCeiling) {
        this(defaultPollCeiling, Sleeper.THREAD);
    }

    public StateWaiter(Duration defaultPollCeiling, Sleeper sleeper) {
        this.defaultPollCeiling = defaultPollCeiling;
        this.sleeper = sleeper;
    }

    /**
     * Waits using the default poll ceiling.
     *
     * @see #waitForState(MachineHandle, MachineState, Duration, Duration)
     */
    public void waitForState(MachineHandle machine, MachineState target, Duration timeout) {
        waitForState(machine, target, timeout, defaultPollCeiling);
    }

    /**
     * Blocks until {@code machine.getState() == target}.
     *
     * @param machine     machine to observe
     * @param target      state to wait for
     * @param timeout     total time budget
     * @param pollCeiling upper bound for a single poll delay
     * @throws StateTimeoutException when the target is not observed in time
     * @throws MachineException      when the state cannot be read or the thread is interrupted
     */
    public void waitForState(MachineHandle machine, MachineState target,
                             Duration timeout, Duration pollCeiling) {
        var backoff = new BackoffSchedule(pollCeiling);
        long startNanos = System.nanoTime();
        long deadlineNanos = startNanos + timeout.toNanos();
        int polls = 0;

        while (true) {
            MachineState observed = machine.getState();
            polls++;
            if (observed == target) {
                log.debug("Machine {} reached {} after {} polls in {}ms",
                        machine.name(), target, polls, elapsedMillis(startNanos));
                return;
            }

            long remainingNanos = deadlineNanos - System.nanoTime();
            if (remainingNanos <= 0) {
                log.warn("Machine {} did not reach {} within {}ms (last state {})",
                        machine.name(), target, timeout.toMillis(), observed);
                throw new StateTimeoutException(machine.name(), target, observed, timeout);
            }

            Duration delay = backoff.nextDelay();
            Duration remaining = Duration.ofNanos(remainingNanos);
            try {
                sleeper.sleep(delay.compareTo(remaining) <= 0 ? delay : remaining);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new MachineException("Interrupted while waiting for " + machine.name()
                        + " to reach " + target, e);
            }
        }
    }

    private static long elapsedMillis(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
