package com.agentvm.machine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class StateWaiterTest {

    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    /** Records requested delays without sleeping. */
    private final Sleeper recording = sleeps::add;

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private static MachineHandle machineReporting(MachineState first, MachineState... rest) {
        MachineHandle machine = mock(MachineHandle.class);
        when(machine.name()).thenReturn("vm-test");
        when(machine.getState()).thenReturn(first, rest);
        return machine;
    }

    private List<Long> sleptMillis() {
        return sleeps.stream().map(Duration::toMillis).toList();
    }

    @Nested
    @DisplayName("Reaching the target")
    class ReachingTarget {

        @Test
        @DisplayName("returns without sleeping when already in the target state")
        void alreadyThere() {
            var machine = machineReporting(MachineState.RUNNING);
            new StateWaiter(BackoffSchedule.DEFAULT_CEILING, recording)
                    .waitForState(machine, MachineState.RUNNING, Duration.ofSeconds(5));

            assertTrue(sleeps.isEmpty());
            verify(machine, times(1)).getState();
        }

        @Test
        @DisplayName("polls with 50, 100, 200, 400, 500, 500ms delays")
        void backoffSequence() {
            var c = MachineState.CREATING;
            var machine = machineReporting(c, c, c, c, c, c, MachineState.RUNNING);

            new StateWaiter(BackoffSchedule.DEFAULT_CEILING, recording)
                    .waitForState(machine, MachineState.RUNNING, Duration.ofSeconds(60));

            assertEquals(List.of(50L, 100L, 200L, 400L, 500L, 500L), sleptMillis());
            verify(machine, times(7)).getState();
        }

        @Test
        @DisplayName("explicit poll ceiling overrides the default")
        void explicitCeiling() {
            var s = MachineState.SHUTTING_DOWN;
            var machine = machineReporting(s, s, s, s, MachineState.STOPPED);

            new StateWaiter(BackoffSchedule.DEFAULT_CEILING, recording)
                    .waitForState(machine, MachineState.STOPPED, Duration.ofSeconds(60), Duration.ofMillis(200));

            assertEquals(List.of(50L, 100L, 200L, 200L), sleptMillis());
        }
    }

    @Nested
    @DisplayName("Timeouts")
    class Timeouts {

        @Test
        @DisplayName("throws StateTimeoutException carrying target, last state and timeout")
        void timesOut() {
            MachineHandle machine = mock(MachineHandle.class);
            when(machine.name()).thenReturn("vm-slow");
            when(machine.getState()).thenReturn(MachineState.CREATING);
            var waiter = new StateWaiter();

            long start = System.nanoTime();
            var ex = assertThrows(StateTimeoutException.class,
                    () -> waiter.waitForState(machine, MachineState.RUNNING, Duration.ofMillis(300)));
            long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

            assertEquals(MachineState.RUNNING, ex.getTargetState());
            assertEquals(MachineState.CREATING, ex.getLastObservedState());
            assertEquals(Duration.ofMillis(300), ex.getTimeout());
            assertTrue(ex.getMessage().contains("vm-slow"));
            assertTrue(elapsedMs >= 300, "returned early after " + elapsedMs + "ms");
            assertTrue(elapsedMs < 300 + 500 + 250, "overran the deadline: " + elapsedMs + "ms");
        }

        @Test
        @DisplayName("last sleep is clipped to the time remaining")
        void lastSleepClipped() {
            MachineHandle machine = mock(MachineHandle.class);
            when(machine.name()).thenReturn("vm-slow");
            when(machine.getState()).thenReturn(MachineState.CREATING);
            Sleeper sleepingRecorder = d -> {
                sleeps.add(d);
                Thread.sleep(d.toMillis());
            };

            assertThrows(StateTimeoutException.class,
                    () -> new StateWaiter(BackoffSchedule.DEFAULT_CEILING, sleepingRecorder)
                            .waitForState(machine, MachineState.RUNNING, Duration.ofMillis(120)));

            assertEquals(50L, sleptMillis().get(0));
            assertTrue(sleptMillis().get(1) <= 70, "second sleep not clipped: " + sleptMillis());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("interrupt restores the flag and raises MachineException")
        void interrupted() {
            var machine = machineReporting(MachineState.CREATING);
            Sleeper interrupting = d -> {
                throw new InterruptedException("stop");
            };

            assertThrows(MachineException.class,
                    () -> new StateWaiter(BackoffSchedule.DEFAULT_CEILING, interrupting)
                            .waitForState(machine, MachineState.RUNNING, Duration.ofSeconds(5)));
            assertTrue(Thread.currentThread().isInterrupted());
        }

        @Test
        @DisplayName("backend errors while reading state propagate")
        void backendErrorPropagates() {
            MachineHandle machine = mock(MachineHandle.class);
            when(machine.getState()).thenThrow(new MachineException("connection to hypervisor lost"));

            var ex = assertThrows(MachineException.class,
                    () -> new StateWaiter(BackoffSchedule.DEFAULT_CEILING, recording)
                            .waitForState(machine, MachineState.RUNNING, Duration.ofSeconds(5)));
            assertEquals("connection to hypervisor lost", ex.getMessage());
        }
    }
}
