package retrain.orchestrator.error;

/**
 * Base exception for all orchestrator domain errors.
 * Carries an error code used in API responses and logs.
 */
public class OrchestratorException extends RuntimeException {

    private final String errorCode;

    public OrchestratorException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public OrchestratorException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
