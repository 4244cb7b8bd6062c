package retrain.orchestrator.repository;

import retrain.orchestrator.model.NotificationRecord;

import java.util.List;

/**
 * Audit log of notification delivery attempts.
 */
public interface NotificationRepository {

    void append(NotificationRecord record);

    /** Records for a job, oldest first */
    List<NotificationRecord> findByJobId(String jobId);
}
