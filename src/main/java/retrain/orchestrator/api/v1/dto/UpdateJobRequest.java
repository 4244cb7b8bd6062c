package retrain.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import retrain.orchestrator.model.JobUpdate;

import java.util.List;

/**
 * Request DTO for a partial job update. Absent fields are left unchanged.
 * PUT /api/v1/jobs/{jobId}
 */
public record UpdateJobRequest(
        @JsonProperty("name") String name,
        @JsonProperty("image") String image,
        @JsonProperty("command") List<String> command,
        @JsonProperty("schedule") String schedule,
        @JsonProperty("max_retries") Integer maxRetries,
        @JsonProperty("checkpoint_path") String checkpointPath) {

    public JobUpdate toUpdate() {
        return new JobUpdate(name, image, command, schedule, maxRetries, checkpointPath);
    }
}
