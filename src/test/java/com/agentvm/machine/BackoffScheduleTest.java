package com.agentvm.machine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BackoffScheduleTest {

    private static List<Long> take(BackoffSchedule schedule, int n) {
        var delays = new ArrayList<Long>();
        for (int i = 0; i < n; i++) {
            delays.add(schedule.nextDelay().toMillis());
        }
        return delays;
    }

    @Test
    @DisplayName("default schedule doubles from 50ms and caps at 500ms")
    void defaultSequence() {
        var schedule = new BackoffSchedule(BackoffSchedule.DEFAULT_CEILING);
        assertEquals(List.of(50L, 100L, 200L, 400L, 500L, 500L, 500L), take(schedule, 7));
    }

    @Test
    @DisplayName("lower ceiling caps earlier")
    void lowerCeiling() {
        var schedule = new BackoffSchedule(Duration.ofMillis(150));
        assertEquals(List.of(50L, 100L, 150L, 150L), take(schedule, 4));
    }

    @Test
    @DisplayName("ceiling below the default initial delay becomes the only delay")
    void ceilingBelowInitial() {
        var schedule = new BackoffSchedule(Duration.ofMillis(20));
        assertEquals(List.of(20L, 20L, 20L), take(schedule, 3));
    }

    @Test
    @DisplayName("rejects non-positive initial delay and ceiling below initial")
    void rejectsInvalidBounds() {
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffSchedule(Duration.ZERO, Duration.ofMillis(100)));
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffSchedule(Duration.ofMillis(100), Duration.ofMillis(50)));
    }
}
