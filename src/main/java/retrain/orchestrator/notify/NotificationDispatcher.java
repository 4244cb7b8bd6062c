package retrain.orchestrator.notify;

import retrain.orchestrator.metrics.OrchestratorMetrics;
import retrain.orchestrator.model.Job;
import retrain.orchestrator.model.NotificationRecord;
import retrain.orchestrator.repository.NotificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fans a job transition out to every configured channel.
 *
 * <p>Delivery runs on the given executor so a slow webhook never blocks a
 * tick. Channels are independent: a failure on one does not stop the others,
 * and every attempt lands in the audit log and the notification counters as
 * sent or failed.
 */
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final List<Notifier> notifiers;
    private final NotificationRepository notificationRepository;
    private final OrchestratorMetrics metrics;
    private final Executor executor;
    private final Clock clock;

    public NotificationDispatcher(List<Notifier> notifiers, NotificationRepository notificationRepository,
            OrchestratorMetrics metrics, Executor executor, Clock clock) {
        this.notifiers = List.copyOf(notifiers);
        this.notificationRepository = notificationRepository;
        this.metrics = metrics;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Queue delivery of {@code message} about the job's current state.
     * Never throws.
     */
    public void dispatch(Job job, String message) {
        if (notifiers.isEmpty()) {
            log.debug("No notification channels configured, dropping message for job {}", job.id());
            return;
        }

        NotificationEvent event = NotificationEvent.of(job, message, clock.instant());
        try {
            executor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.warn("Notification for job {} rejected: {}", job.id(), e.getMessage());
        }
    }

    public List<String> channels() {
        return notifiers.stream().map(Notifier::channel).toList();
    }

    void deliver(NotificationEvent event) {
        for (Notifier notifier : notifiers) {
            NotificationRecord record;
            try {
                notifier.send(event);
                record = NotificationRecord.sent(notifier.channel(), event.jobId(), event.message(), clock.instant());
                metrics.notificationSent(notifier.channel());
                log.info("{} notification sent for job {}", notifier.channel(), event.jobId());
            } catch (Exception e) {
                record = NotificationRecord.failed(notifier.channel(), event.jobId(), event.message(),
                        e.getMessage(), clock.instant());
                metrics.notificationFailed(notifier.channel());
                log.error("Failed to send {} notification for job {}: {}",
                        notifier.channel(), event.jobId(), e.getMessage());
            }
            audit(record);
        }
    }

    private void audit(NotificationRecord record) {
        try {
            notificationRepository.append(record);
        } catch (Exception e) {
            log.error("Failed to record {} notification for job {}", record.channel(), record.jobId(), e);
        }
    }
}
