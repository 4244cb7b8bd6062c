package retrain.orchestrator.error;

/**
 * Thrown when the execution backend is unreachable or answers with
 * something that cannot be interpreted.
 */
public class BackendException extends OrchestratorException {

    private static final String ERROR_CODE = "BACKEND_ERR";

    public BackendException(String message) {
        super(ERROR_CODE, message);
    }

    public BackendException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
