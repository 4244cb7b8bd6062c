package retrain.orchestrator.repository;

import retrain.orchestrator.model.MetricSample;

import java.util.List;

/**
 * Storage for per-job metric samples.
 */
public interface MetricRepository {

    void record(MetricSample sample);

    /** Samples for a job, oldest first */
    List<MetricSample> findByJobId(String jobId);
}
