package retrain.orchestrator.notify;

import retrain.orchestrator.model.Job;
import retrain.orchestrator.model.JobStatus;

import java.time.Instant;

/**
 * Snapshot of a job transition handed to every channel.
 */
public record NotificationEvent(
        String jobId,
        String jobName,
        JobStatus status,
        int retryCount,
        int maxRetries,
        String message,
        String errorMessage,
        Instant startedAt,
        Instant completedAt,
        Instant occurredAt) {

    public static NotificationEvent of(Job job, String message, Instant occurredAt) {
        return new NotificationEvent(
                job.id(),
                job.name(),
                job.status(),
                job.retryCount(),
                job.maxRetries(),
                message,
                job.errorMessage(),
                job.lastStartedAt(),
                job.lastCompletedAt(),
                occurredAt);
    }
}
