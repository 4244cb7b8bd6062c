package retrain.orchestrator.api.v1.dto;

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
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("service") String service,
        @JsonProperty("database_connected") boolean databaseConnected,
        @JsonProperty("backend") String backend,
        @JsonProperty("scheduler_running") Boolean schedulerRunning,
        @JsonProperty("uptime") String uptime) {

    static final String SERVICE = "retrain-orchestrator";

    public static HealthResponse healthy(Instant now, String backend, boolean schedulerRunning, String uptime) {
        return new HealthResponse("healthy", now, SERVICE, true, backend, schedulerRunning, uptime);
    }

    public static HealthResponse unhealthy(Instant now) {
        return new HealthResponse("unhealthy", now, SERVICE, false, null, null, null);
    }
}
