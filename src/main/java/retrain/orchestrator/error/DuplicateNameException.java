package retrain.orchestrator.error;

/**
 * Thrown when a job name is already taken by an existing job.
 */
public class DuplicateNameException extends OrchestratorException {

    private static final String ERROR_CODE = "DUPLICATE_NAME";

    public DuplicateNameException(String name) {
        super(ERROR_CODE, "Job with name '" + name + "' already exists");
    }
}
