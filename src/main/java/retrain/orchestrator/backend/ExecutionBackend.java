package retrain.orchestrator.backend;

import retrain.orchestrator.error.BackendException;

import java.util.List;

/**
 * Runs job attempts somewhere else (a container engine, a cluster, a
 * simulation). The orchestrator only submits and polls; it never waits on a
 * workload.
 */
public interface ExecutionBackend extends AutoCloseable {

    /**
     * Start one attempt. Submitting the same job and execution number again
     * must not start a second workload: an attempt that is already running
     * is returned as is.
     *
     * @param jobId           owning job, exposed to the workload as JOB_ID
     * @param executionNumber attempt number within the job
     * @param image           container image reference
     * @param command         full command, resume arguments included
     * @param checkpointPath  checkpoint directory, may be null
     * @return opaque handle used for polling
     * @throws BackendException if the backend could not be reached or refused
     *                          the attempt
     */
    String submit(String jobId, int executionNumber, String image, List<String> command, String checkpointPath);

    /**
     * Observe an attempt previously returned by {@link #submit}.
     *
     * @throws BackendException if the status could not be determined
     */
    PollResult poll(String handle);

    /**
     * Free whatever the backend keeps for a finished attempt. Called once the
     * attempt's outcome has been committed.
     */
    default void release(String handle) {
    }

    /** Short name for logs and the health endpoint */
    String name();

    @Override
    default void close() {
    }
}
