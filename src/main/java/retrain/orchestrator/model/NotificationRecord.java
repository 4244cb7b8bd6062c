package retrain.orchestrator.model;

import java.time.Instant;

/**
 * Audit entry for one delivery attempt on one channel. Write-once.
 */
public record NotificationRecord(
        String channel,
        String jobId,
        String message,
        boolean success,
        String errorMessage,
        Instant sentAt) {

    public static NotificationRecord sent(String channel, String jobId, String message, Instant at) {
        return new NotificationRecord(channel, jobId, message, true, null, at);
    }

    public static NotificationRecord failed(String channel, String jobId, String message, String error,
            Instant at) {
        return new NotificationRecord(channel, jobId, message, false, error, at);
    }

    /** Stored status value: "sent" or "failed" */
    public String status() {
        return success ? "sent" : "failed";
    }
}
