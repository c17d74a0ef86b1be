package cronarchy.scheduler.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RunnerStateTest {

    @Test
    void codesAreStable() {
        assertEquals(0, RunnerState.STOPPED.code());
        assertEquals(1, RunnerState.IDLE.code());
        assertEquals(2, RunnerState.QUEUED.code());
        assertEquals(3, RunnerState.PREPARING.code());
        assertEquals(4, RunnerState.RUNNING.code());
    }

    @Test
    void fromCodeRoundTripsAndFallsBack() {
        for (RunnerState state : RunnerState.values()) {
            assertEquals(state, RunnerState.fromCode(state.code()));
        }
        assertEquals(RunnerState.STOPPED, RunnerState.fromCode(99));
    }

    @Test
    void ordering() {
        assertTrue(RunnerState.RUNNING.isAfter(RunnerState.QUEUED));
        assertTrue(RunnerState.IDLE.isBefore(RunnerState.QUEUED));
        assertTrue(RunnerState.STOPPED.isAtRest());
        assertTrue(RunnerState.IDLE.isAtRest());
        assertFalse(RunnerState.QUEUED.isAtRest());
    }
}
