package retrain.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import retrain.orchestrator.model.JobStats;
import retrain.orchestrator.model.JobStatus;

/**
 * GET /api/v1/stats
 */
public record StatsResponse(
        @JsonProperty("total_jobs") int totalJobs,
        @JsonProperty("pending") int pending,
        @JsonProperty("running") int running,
        @JsonProperty("completed") int completed,
        @JsonProperty("failed") int failed,
        @JsonProperty("retrying") int retrying) {

    public static StatsResponse from(JobStats stats) {
        return new StatsResponse(
                stats.total(),
                stats.count(JobStatus.PENDING),
                stats.count(JobStatus.RUNNING),
                stats.count(JobStatus.COMPLETED),
                stats.count(JobStatus.FAILED),
                stats.count(JobStatus.RETRYING));
    }
}
