package cronarchy.scheduler.runner;

import cronarchy.scheduler.model.RunnerState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RunnerGateTest {

    private static final Duration INTERVAL = Duration.ofSeconds(10);
    private static final Duration MAX_TOTAL = Duration.ofSeconds(600);
    private static final long NOW = 1_700_000_000L;

    private static GateDecision evaluate(RunnerState state, long changedAgo, long lastRunAgo) {
        RunnerSnapshot snapshot = new RunnerSnapshot(
                state,
                Instant.ofEpochSecond(NOW - changedAgo),
                Instant.ofEpochSecond(NOW - lastRunAgo));
        return RunnerGate.evaluate(snapshot, INTERVAL, MAX_TOTAL, Instant.ofEpochSecond(NOW));
    }

    @Test
    void restStateAllowsAfterInterval() {
        GateDecision decision = evaluate(RunnerState.STOPPED, 100, 100);

        assertTrue(decision.allowed());
        assertEquals(RunnerState.QUEUED, decision.nextState());
    }

    @Test
    void neverRunAllows() {
        RunnerSnapshot fresh = new RunnerSnapshot(RunnerState.STOPPED, Instant.EPOCH, Instant.EPOCH);

        assertTrue(RunnerGate.evaluate(fresh, INTERVAL, MAX_TOTAL, Instant.ofEpochSecond(NOW)).allowed());
    }

    @Test
    void idleIsARestState() {
        assertTrue(evaluate(RunnerState.IDLE, 100, 100).allowed());
    }

    @Test
    void recentRunIsRateLimited() {
        GateDecision decision = evaluate(RunnerState.STOPPED, 3, 3);

        assertFalse(decision.allowed());
        assertEquals(RunnerState.STOPPED, decision.nextState());
    }

    @Test
    void rateLimitBoundaryIsExclusive() {
        assertFalse(evaluate(RunnerState.STOPPED, 9, 9).allowed());
        assertTrue(evaluate(RunnerState.STOPPED, 10, 10).allowed());
    }

    @Test
    void runningWithinBudgetIsRefused() {
        GateDecision decision = evaluate(RunnerState.RUNNING, 120, 1000);

        assertFalse(decision.allowed());
        assertEquals(RunnerState.RUNNING, decision.nextState());
    }

    @Test
    void preparingWithinBudgetIsRefused() {
        assertFalse(evaluate(RunnerState.PREPARING, 5, 1000).allowed());
    }

    @Test
    void stuckRunningSelfHeals() {
        GateDecision decision = evaluate(RunnerState.RUNNING, 601, 1000);

        assertTrue(decision.allowed());
        assertEquals(RunnerState.QUEUED, decision.nextState());
    }

    @Test
    void stuckPreparingSelfHeals() {
        assertTrue(evaluate(RunnerState.PREPARING, 700, 700).allowed());
    }

    @Test
    void queuedNeverPickedUpIsUnstuckEvenAfterRecentRun() {
        // last run 2s ago would normally rate-limit
        GateDecision decision = evaluate(RunnerState.QUEUED, 11, 2);

        assertTrue(decision.allowed());
    }

    @Test
    void freshlyQueuedIsNotDoubled() {
        assertFalse(evaluate(RunnerState.QUEUED, 3, 2).allowed());
        assertFalse(evaluate(RunnerState.QUEUED, 5, 500).allowed());
    }

    @Test
    void queuedAtExactlyIntervalStillRefused() {
        assertFalse(evaluate(RunnerState.QUEUED, 10, 500).allowed());
    }
}
