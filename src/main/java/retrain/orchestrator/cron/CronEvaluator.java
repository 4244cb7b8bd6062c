package retrain.orchestrator.cron;

import retrain.orchestrator.error.ValidationException;

import java.time.Instant;

/**
 * Computes fire times for schedule expressions. Implementations are stateless
 * from the caller's point of view.
 */
public interface CronEvaluator {

    /**
     * Next fire time strictly after {@code after}.
     *
     * @throws ValidationException if the expression is malformed or never fires
     */
    Instant nextFireTime(String schedule, Instant after);

    /**
     * Reject malformed expressions.
     *
     * @throws ValidationException if the expression is malformed
     */
    void validate(String schedule);

    /**
     * Whether the schedule has fired at least once after {@code anchor} and no
     * later than {@code now}.
     */
    default boolean isDue(String schedule, Instant anchor, Instant now) {
        return !nextFireTime(schedule, anchor).isAfter(now);
    }
}
