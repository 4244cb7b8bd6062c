package retrain.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import retrain.orchestrator.model.Execution;

import java.time.Instant;

/**
 * One entry of GET /api/v1/jobs/{jobId}/executions
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResponse(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("execution_number") int executionNumber,
        @JsonProperty("status") String status,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("completed_at") Instant completedAt,
        @JsonProperty("duration_seconds") Long durationSeconds,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("checkpoint_used") String checkpointUsed) {

    public static ExecutionResponse from(Execution execution) {
        return new ExecutionResponse(
                execution.jobId(),
                execution.executionNumber(),
                execution.status().value(),
                execution.startedAt(),
                execution.completedAt(),
                execution.durationSeconds(),
                execution.errorMessage(),
                execution.checkpointUsed());
    }
}
