package retrain.orchestrator.error;

/**
 * Thrown by the command-line client when the orchestrator API cannot be
 * reached or answers with an error status.
 */
public class ApiClientException extends OrchestratorException {

    private static final String ERROR_CODE = "API_ERR";

    private final int statusCode;

    public ApiClientException(int statusCode, String errorCode, String message) {
        super(errorCode != null ? errorCode : ERROR_CODE, message);
        this.statusCode = statusCode;
    }

    public ApiClientException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
        this.statusCode = 0;
    }

    /** HTTP status of the failed call, 0 if no response was received */
    public int getStatusCode() {
        return statusCode;
    }
}
