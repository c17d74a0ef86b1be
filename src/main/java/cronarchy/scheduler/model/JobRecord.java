package cronarchy.scheduler.model;

import java.time.Instant;

/**
 * Stored form of a job: one row of the jobs table, with args still serialized.
 */
public record JobRecord(
        Long id,
        Instant dueAt,
        String hook,
        String args,
        Long recurrence) {

    public JobRecord withId(Long newId) {
        return new JobRecord(newId, dueAt, hook, args, recurrence);
    }
}
