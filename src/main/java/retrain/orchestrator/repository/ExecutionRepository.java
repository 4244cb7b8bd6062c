package retrain.orchestrator.repository;

import retrain.orchestrator.model.Execution;

import java.util.List;
import java.util.Optional;

/**
 * Log of execution attempts, keyed by (jobId, executionNumber). Rows are only
 * appended, closed, or discarded while still unsubmitted.
 */
public interface ExecutionRepository {

    /**
     * Append a new execution.
     *
     * @throws IllegalStateException if the (jobId, executionNumber) key exists
     */
    void append(Execution execution);

    /**
     * Record the backend handle on a running execution.
     *
     * @return true if the running execution was found
     */
    boolean attachHandle(String jobId, int executionNumber, String handle);

    /**
     * Close a running execution. Rows that are already terminal are left
     * untouched.
     *
     * @return true if the execution was running and is now terminal
     */
    boolean finish(Execution terminal);

    /**
     * Remove a running execution that never got a backend handle, freeing its
     * number for the next launch.
     *
     * @return true if such an execution was removed
     */
    boolean discard(String jobId, int executionNumber);

    /**
     * Highest execution number used for the job, 0 if none.
     */
    int lastExecutionNumber(String jobId);

    /**
     * The running execution of a job, if any.
     */
    Optional<Execution> findRunning(String jobId);

    /**
     * Number of running executions for a job.
     */
    int countRunning(String jobId);

    /**
     * All executions of a job in execution-number order.
     */
    List<Execution> findByJobId(String jobId);
}
