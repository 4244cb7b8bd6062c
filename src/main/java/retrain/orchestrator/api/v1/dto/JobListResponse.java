package retrain.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import retrain.orchestrator.model.JobPage;

import java.util.List;

/**
 * GET /api/v1/jobs
 */
public record JobListResponse(
        @JsonProperty("jobs") List<JobResponse> jobs,
        @JsonProperty("total") int total,
        @JsonProperty("page") int page,
        @JsonProperty("page_size") int pageSize) {

    public static JobListResponse from(JobPage page) {
        return new JobListResponse(
                page.jobs().stream().map(JobResponse::from).toList(),
                page.total(),
                page.page(),
                page.pageSize());
    }
}
