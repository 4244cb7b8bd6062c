package retrain.orchestrator.model;

import java.time.Instant;

/**
 * Named numeric measurement for a job, kept for external observability only.
 */
public record MetricSample(String jobId, String name, double value, Instant recordedAt) {

    public static final String EXECUTION_DURATION_SECONDS = "execution_duration_seconds";
    public static final String RETRY_COUNT = "retry_count";
}
