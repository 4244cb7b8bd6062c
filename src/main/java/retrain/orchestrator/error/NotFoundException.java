package retrain.orchestrator.error;

/**
 * Thrown when a requested job does not exist.
 */
public class NotFoundException extends OrchestratorException {

    private static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String jobId) {
        super(ERROR_CODE, "Job " + jobId + " not found");
    }
}
