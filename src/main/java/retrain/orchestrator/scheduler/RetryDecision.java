package retrain.orchestrator.scheduler;

/**
 * Outcome of applying the retry policy to a failed execution.
 */
public enum RetryDecision {
    /** Schedule another attempt from the job's checkpoint */
    RETRY_WITH_CHECKPOINT,

    /** Retries exhausted, the job fails */
    TERMINAL_FAILURE
}
