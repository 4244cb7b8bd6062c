package retrain.orchestrator.notify;

import retrain.orchestrator.error.NotificationException;

/**
 * One delivery channel (Slack, email, ...).
 */
public interface Notifier {

    /** Channel name stored in the audit log */
    String channel();

    /**
     * Deliver one event. Must not retry internally.
     *
     * @throws NotificationException if delivery failed
     */
    void send(NotificationEvent event);
}
