package retrain.orchestrator.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import retrain.orchestrator.model.Execution;
import retrain.orchestrator.model.Job;
import retrain.orchestrator.model.JobStatus;
import retrain.orchestrator.repository.JobRepository;

/**
 * Prometheus meters for jobs, executions and notifications.
 *
 * <p>Job counts by status are gauges read from the registry of jobs at scrape
 * time; everything else is recorded as it happens.
 */
public final class OrchestratorMetrics {

    private static final double[] DURATION_BUCKETS_SECONDS = {
            60, 300, 600, 1800, 3600, 7200, 14400, 28800, 86400
    };

    private final PrometheusMeterRegistry registry;

    public OrchestratorMetrics(PrometheusMeterRegistry registry, JobRepository jobRepository) {
        this.registry = registry;

        for (JobStatus status : JobStatus.values()) {
            Gauge.builder("training.jobs", jobRepository, repository -> repository.count(status))
                    .description("Training jobs by current status")
                    .tag("status", status.value())
                    .register(registry);
        }
    }

    public static OrchestratorMetrics prometheus(JobRepository jobRepository) {
        return new OrchestratorMetrics(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT), jobRepository);
    }

    public void jobRegistered(Job job) {
        Counter.builder("training.jobs.created")
                .description("Training jobs registered")
                .tag("job_name", job.name())
                .register(registry)
                .increment();
    }

    public void executionFinished(Job job, Execution terminal) {
        Counter.builder("training.executions")
                .description("Finished executions by outcome")
                .tag("job_name", job.name())
                .tag("status", terminal.status().name().toLowerCase())
                .register(registry)
                .increment();

        if (terminal.durationSeconds() != null) {
            DistributionSummary.builder("training.jobs.duration")
                    .description("Duration of training executions")
                    .baseUnit("seconds")
                    .tag("job_name", job.name())
                    .tag("status", terminal.status().name().toLowerCase())
                    .serviceLevelObjectives(DURATION_BUCKETS_SECONDS)
                    .register(registry)
                    .record(terminal.durationSeconds());
        }
    }

    public void retryScheduled(Job job) {
        Counter.builder("training.jobs.retries")
                .description("Retries scheduled after a failed execution")
                .tag("job_name", job.name())
                .register(registry)
                .increment();
    }

    public void notificationSent(String channel) {
        Counter.builder("notification.sent")
                .description("Notifications delivered")
                .tag("channel", channel)
                .register(registry)
                .increment();
    }

    public void notificationFailed(String channel) {
        Counter.builder("notification.failures")
                .description("Notifications that could not be delivered")
                .tag("channel", channel)
                .register(registry)
                .increment();
    }

    /** Current values in the Prometheus text exposition format */
    public String scrape() {
        return registry.scrape();
    }

    public PrometheusMeterRegistry registry() {
        return registry;
    }
}
