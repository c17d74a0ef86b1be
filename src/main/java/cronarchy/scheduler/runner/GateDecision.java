package cronarchy.scheduler.runner;

import cronarchy.scheduler.model.RunnerState;

/**
 * Outcome of a gate check.
 *
 * @param allowed   whether a new run may be triggered
 * @param nextState state to persist when triggering (unchanged when refused)
 * @param reason    short description for logs
 */
public record GateDecision(
        boolean allowed,
        RunnerState nextState,
        String reason) {

    static GateDecision allow(String reason) {
        return new GateDecision(true, RunnerState.QUEUED, reason);
    }

    static GateDecision refuse(RunnerState current, String reason) {
        return new GateDecision(false, current, reason);
    }
}
