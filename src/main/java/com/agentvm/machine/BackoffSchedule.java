package com.agentvm.machine;

import java.time.Duration;

/**
 * Exponential poll delay: starts at an initial interval and doubles on every call to
 * {@link #nextDelay()}, never exceeding the ceiling. Not thread-safe; one per wait.
 */
public class BackoffSchedule {

    public static final Duration DEFAULT_INITIAL = Duration.ofMillis(50);
    public static final Duration DEFAULT_CEILING = Duration.ofMillis(500);

    private final long ceilingMillis;
    private long currentMillis;

    public BackoffSchedule(Duration initial, Duration ceiling) {
        if (initial.isNegative() || initial.isZero()) {
            throw new IllegalArgumentException("Initial interval must be positive: " + initial);
        }
        if (ceiling.compareTo(initial) < 0) {
            throw new IllegalArgumentException("Ceiling " + ceiling + " is below initial interval " + initial);
        }
        this.ceilingMillis = ceiling.toMillis();
        this.currentMillis = initial.toMillis();
    }

    public BackoffSchedule(Duration ceiling) {
        this(DEFAULT_INITIAL.compareTo(ceiling) <= 0 ? DEFAULT_INITIAL : ceiling, ceiling);
    }

    /**
     * @return the delay to use for this attempt; the following call returns twice as much, up to the ceiling
     */
    public Duration nextDelay() {
        long delay = currentMillis;
        currentMillis = Math.min(currentMillis * 2, ceilingMillis);
        return Duration.ofMillis(delay);
    }
}
