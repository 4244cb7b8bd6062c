package retrain.orchestrator.error;

/**
 * Thrown by a notification channel when delivery fails.
 * Only ever recorded in the audit log.
 */
public class NotificationException extends OrchestratorException {

    private static final String ERROR_CODE = "NOTIFY_ERR";

    public NotificationException(String channel, String message) {
        super(ERROR_CODE, channel + ": " + message);
    }

    public NotificationException(String channel, String message, Throwable cause) {
        super(ERROR_CODE, channel + ": " + message, cause);
    }
}
