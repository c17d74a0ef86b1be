package cronarchy.scheduler.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("instanceId") String instanceId,
        @JsonProperty("runnerState") String runnerState,
        @JsonProperty("lastRunAt") Instant lastRunAt,
        @JsonProperty("pendingJobs") Integer pendingJobs) {

    public static HealthResponse healthy(String uptime, String version, String instanceId, String runnerState,
            Instant lastRunAt, int pendingJobs) {
        return new HealthResponse("healthy", "ok", uptime, version, instanceId, runnerState, lastRunAt,
                pendingJobs);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null, null);
    }
}
