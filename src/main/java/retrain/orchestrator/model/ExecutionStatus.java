package retrain.orchestrator.model;

import java.util.Locale;

/**
 * Status of a single execution attempt.
 */
public enum ExecutionStatus {
    RUNNING,
    COMPLETED,
    FAILED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
