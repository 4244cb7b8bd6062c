package retrain.orchestrator.scheduler;

/**
 * When a job in RETRYING becomes eligible to launch again.
 */
public enum RetryMode {
    /** Wait for the job's next cron fire */
    ON_SCHEDULE,
    /** Wait min(base * 2^retryCount, max) after the failure, ignoring the schedule */
    BACKOFF
}
