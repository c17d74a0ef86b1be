package cronarchy.scheduler.runner;

import cronarchy.scheduler.model.RunnerState;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a new daemon run may start.
 *
 * <p>Triggers arrive from uncoordinated requests, so this is an optimistic,
 * self-healing approximation of a lock: refusing a safe run is acceptable,
 * two overlapping runs are rare but possible.
 *
 * <ol>
 * <li>Less than {@code runInterval} since the last run: refuse, unless the
 * state is QUEUED and has not changed for more than {@code runInterval}
 * (the queued request was never picked up).</li>
 * <li>PREPARING or RUNNING for less than {@code maxTotalRunTime}: refuse.</li>
 * <li>Otherwise allow from a rest state, from a PREPARING/RUNNING state that
 * outlived {@code maxTotalRunTime} (stuck), or from a QUEUED state older
 * than {@code runInterval}.</li>
 * </ol>
 *
 * All arithmetic is in whole seconds.
 */
public final class RunnerGate {

    private RunnerGate() {
    }

    public static GateDecision evaluate(RunnerSnapshot snapshot, Duration runInterval, Duration maxTotalRunTime,
            Instant now) {
        RunnerState state = snapshot.state();
        long sinceRun = now.getEpochSecond() - snapshot.lastRunAt().getEpochSecond();
        long sinceChange = now.getEpochSecond() - snapshot.lastStateChangeAt().getEpochSecond();
        long interval = runInterval.toSeconds();
        boolean queuedTooLong = state == RunnerState.QUEUED && sinceChange > interval;

        if (sinceRun < interval) {
            if (queuedTooLong) {
                return GateDecision.allow("queued for " + sinceChange + "s without being picked up");
            }
            return GateDecision.refuse(state, "last run " + sinceRun + "s ago");
        }

        if (state.isAfter(RunnerState.QUEUED) && sinceChange < maxTotalRunTime.toSeconds()) {
            return GateDecision.refuse(state, state + " for " + sinceChange + "s");
        }

        if (state.isAtRest()) {
            return GateDecision.allow("at rest");
        }
        if (state == RunnerState.QUEUED) {
            return queuedTooLong
                    ? GateDecision.allow("queued for " + sinceChange + "s without being picked up")
                    : GateDecision.refuse(state, "trigger in flight for " + sinceChange + "s");
        }
        return GateDecision.allow(state + " stuck for " + sinceChange + "s");
    }
}
