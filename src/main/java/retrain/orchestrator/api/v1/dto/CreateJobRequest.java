package retrain.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import retrain.orchestrator.error.ValidationException;

import java.util.List;

/**
 * Request DTO for registering a job.
 * POST /api/v1/jobs
 */
public record CreateJobRequest(
        @JsonProperty("name") String name,
        @JsonProperty("image") String image,
        @JsonProperty("command") List<String> command,
        @JsonProperty("schedule") String schedule,
        @JsonProperty("max_retries") Integer maxRetries,
        @JsonProperty("checkpoint_path") String checkpointPath) {

    /** Presence checks; value rules are enforced by the service */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new ValidationException("name is required");
        }
        if (image == null || image.isBlank()) {
            throw new ValidationException("image is required");
        }
        if (command == null || command.isEmpty()) {
            throw new ValidationException("command must not be empty");
        }
        if (schedule == null || schedule.isBlank()) {
            throw new ValidationException("schedule is required");
        }
    }
}
