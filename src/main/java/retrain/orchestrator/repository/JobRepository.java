package retrain.orchestrator.repository;

import retrain.orchestrator.model.Job;
import retrain.orchestrator.model.JobStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository interface for Job persistence.
 */
public interface JobRepository {

    /**
     * Save a new job.
     *
     * @param job the job to save
     */
    void save(Job job);

    /**
     * Replace all mutable fields of an existing job.
     *
     * @param job the new state
     * @return true if a row was updated
     */
    boolean update(Job job);

    /**
     * Find a job by ID.
     *
     * @param jobId the job ID
     * @return the job if found
     */
    Optional<Job> findById(String jobId);

    /**
     * Find a job by its unique name.
     */
    Optional<Job> findByName(String name);

    /**
     * Get all jobs, most recent first.
     */
    List<Job> findAll();

    /**
     * Get one page of jobs, most recent first.
     *
     * @param status optional status filter, null for all
     * @param offset rows to skip
     * @param limit  maximum rows
     */
    List<Job> findPage(JobStatus status, int offset, int limit);

    /**
     * Count jobs, optionally filtered by status.
     */
    int count(JobStatus status);

    /**
     * Count jobs grouped by status. Missing statuses are absent from the map.
     */
    Map<JobStatus, Integer> countByStatus();

    /**
     * Delete a job and all its executions.
     *
     * @param jobId the job ID
     * @return true if deleted
     */
    boolean delete(String jobId);

    /**
     * Generate a new unique Job ID.
     *
     * @return unique ID like "train-{hex}"
     */
    String generateId();
}
