package cronarchy.scheduler.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import cronarchy.scheduler.model.Job;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for job details.
 * GET /api/v1/jobs/{id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("id") Long id,
        @JsonProperty("hook") String hook,
        @JsonProperty("dueAt") Instant dueAt,
        @JsonProperty("args") List<Object> args,
        @JsonProperty("recurrence") Long recurrence) {

    /** Create response from domain model */
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.id(),
                job.hook(),
                job.dueAt(),
                job.args(),
                job.isRecurring() ? job.recurrence() : null);
    }
}
