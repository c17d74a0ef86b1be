package cronarchy.scheduler.runner;

import cronarchy.scheduler.model.RunnerState;

import java.time.Instant;

/**
 * Runner state as read from the option store at the start of one gate check.
 */
public record RunnerSnapshot(
        RunnerState state,
        Instant lastStateChangeAt,
        Instant lastRunAt) {
}
