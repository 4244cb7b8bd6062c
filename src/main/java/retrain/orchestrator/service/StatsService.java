package retrain.orchestrator.service;

import retrain.orchestrator.model.JobStats;
import retrain.orchestrator.model.JobStatus;
import retrain.orchestrator.repository.JobRepository;

import java.util.Map;

/**
 * Read-only job counts by status.
 */
public class StatsService {

    private final JobRepository jobRepository;

    public StatsService(JobRepository jobRepository) {
        this.jobRepository = jobRepository;
    }

    /**
     * Counts from a single grouped query; the total is their sum.
     */
    public JobStats stats() {
        Map<JobStatus, Integer> byStatus = jobRepository.countByStatus();
        int total = byStatus.values().stream().mapToInt(Integer::intValue).sum();
        return new JobStats(total, byStatus);
    }
}
