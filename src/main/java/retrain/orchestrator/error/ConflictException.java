package retrain.orchestrator.error;

/**
 * Thrown when a request is not allowed in the job's current status,
 * e.g. updating or deleting a running job.
 */
public class ConflictException extends OrchestratorException {

    private static final String ERROR_CODE = "CONFLICT";

    public ConflictException(String message) {
        super(ERROR_CODE, message);
    }
}
