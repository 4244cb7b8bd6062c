package retrain.orchestrator.model;

import java.util.List;

/**
 * One page of a job listing plus the total number of matching jobs.
 */
public record JobPage(List<Job> jobs, int total, int page, int pageSize) {
}
