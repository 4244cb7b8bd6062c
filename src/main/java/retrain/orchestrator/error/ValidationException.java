package retrain.orchestrator.error;

/**
 * Thrown when a job definition is malformed (bad schedule, missing field).
 * The job is never created or changed.
 */
public class ValidationException extends OrchestratorException {

    private static final String ERROR_CODE = "VALIDATION";

    public ValidationException(String message) {
        super(ERROR_CODE, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
