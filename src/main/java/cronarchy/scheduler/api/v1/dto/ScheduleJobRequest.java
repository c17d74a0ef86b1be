package cronarchy.scheduler.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Request DTO for scheduling a job.
 * POST /api/v1/jobs
 *
 * {@code dueAt} is in epoch seconds; {@code recurrence} in seconds, absent or 0 for a one-shot job.
 */
public record ScheduleJobRequest(
        @JsonProperty("hook") String hook,
        @JsonProperty("dueAt") Long dueAt,
        @JsonProperty("args") List<Object> args,
        @JsonProperty("recurrence") Long recurrence) {

    /** 9999-12-31T23:59:59Z, the latest storable due time */
    static final long MAX_EPOCH_SECOND = 253_402_300_799L;

    public Instant dueAtInstant() {
        return Instant.ofEpochSecond(dueAt);
    }

    public List<Object> argsOrEmpty() {
        return args != null ? args : List.of();
    }

    /** Validate the request */
    public void validate() {
        if (hook == null || hook.isBlank()) {
            throw new IllegalArgumentException("hook is required");
        }
        if (hook.length() > 255) {
            throw new IllegalArgumentException("hook must be at most 255 characters");
        }
        if (dueAt == null) {
            throw new IllegalArgumentException("dueAt is required");
        }
        if (dueAt < 0 || dueAt > MAX_EPOCH_SECOND) {
            throw new IllegalArgumentException("dueAt must be between 0 and " + MAX_EPOCH_SECOND + " epoch seconds");
        }
        if (recurrence != null && recurrence < 0) {
            throw new IllegalArgumentException("recurrence must not be negative");
        }
        if (recurrence != null && recurrence > MAX_EPOCH_SECOND) {
            throw new IllegalArgumentException("recurrence must be at most " + MAX_EPOCH_SECOND + " seconds");
        }
    }
}
