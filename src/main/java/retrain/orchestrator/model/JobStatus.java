package retrain.orchestrator.model;

import java.util.Locale;

/**
 * Lifecycle state of a scheduled training job.
 */
public enum JobStatus {
    /** Registered or re-armed, waiting for its schedule to fire */
    PENDING,
    /** An execution is in flight on the backend */
    RUNNING,
    /** Last execution succeeded */
    COMPLETED,
    /** Retries exhausted, needs a manual retry */
    FAILED,
    /** Last execution failed, a retry is pending */
    RETRYING;

    /** Lower-case wire value ("pending", "running", ...) */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Terminal states get no automatic transition */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** States from which the scheduler may launch a new execution */
    public boolean isLaunchable() {
        return this == PENDING || this == RETRYING;
    }

    /**
     * Parse a status, case-insensitive.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static JobStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        try {
            return JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown status: " + value);
        }
    }
}
