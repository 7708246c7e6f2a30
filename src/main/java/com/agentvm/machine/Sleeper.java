package com.agentvm.machine;

import java.time.Duration;

/**
 * Blocking pause between polls. Swapped out in tests to observe the delay sequence.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);

    void sleep(Duration duration) throws InterruptedException;
}
