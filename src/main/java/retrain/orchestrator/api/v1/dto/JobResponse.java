package retrain.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import retrain.orchestrator.model.Job;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for job details.
 * GET /api/v1/jobs/{jobId}
 */
public record JobResponse(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("name") String name,
        @JsonProperty("image") String image,
        @JsonProperty("command") List<String> command,
        @JsonProperty("schedule") String schedule,
        @JsonProperty("max_retries") int maxRetries,
        @JsonProperty("retry_count") int retryCount,
        @JsonProperty("checkpoint_path") String checkpointPath,
        @JsonProperty("status") String status,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("completed_at") Instant completedAt,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt) {

    /** Create response from domain model */
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.id(),
                job.name(),
                job.image(),
                job.command(),
                job.schedule(),
                job.maxRetries(),
                job.retryCount(),
                job.checkpointPath(),
                job.status().value(),
                job.lastStartedAt(),
                job.lastCompletedAt(),
                job.errorMessage(),
                job.createdAt(),
                job.updatedAt());
    }
}
