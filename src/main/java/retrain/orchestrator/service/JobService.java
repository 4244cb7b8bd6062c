package retrain.orchestrator.service;

import retrain.orchestrator.config.OrchestratorConfig;
import retrain.orchestrator.cron.CronEvaluator;
import retrain.orchestrator.error.ConflictException;
import retrain.orchestrator.error.DuplicateNameException;
import retrain.orchestrator.error.NotFoundException;
import retrain.orchestrator.error.ValidationException;
import retrain.orchestrator.metrics.OrchestratorMetrics;
import retrain.orchestrator.model.Execution;
import retrain.orchestrator.model.Job;
import retrain.orchestrator.model.JobPage;
import retrain.orchestrator.model.JobStatus;
import retrain.orchestrator.model.JobUpdate;
import retrain.orchestrator.model.MetricSample;
import retrain.orchestrator.repository.ExecutionRepository;
import retrain.orchestrator.repository.JobRepository;
import retrain.orchestrator.repository.MetricRepository;
import retrain.orchestrator.scheduler.JobLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Job definition management for the API: register, read, list, update,
 * delete and manual retry.
 *
 * <p>Every read-modify-write of an existing job runs under the same per-job
 * lock the scheduler uses, so API calls and ticks never interleave on one job.
 */
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    static final int MAX_NAME_LENGTH = 100;
    static final int MAX_RETRIES_LIMIT = 10;
    static final int MAX_PAGE_SIZE = 100;

    private final JobRepository jobRepository;
    private final ExecutionRepository executionRepository;
    private final MetricRepository metricRepository;
    private final CronEvaluator cron;
    private final JobLocks locks;
    private final OrchestratorMetrics metrics;
    private final int defaultMaxRetries;
    private final Clock clock;

    // guards the name uniqueness check-then-write
    private final Object nameLock = new Object();

    public JobService(JobRepository jobRepository,
            ExecutionRepository executionRepository,
            MetricRepository metricRepository,
            CronEvaluator cron,
            JobLocks locks,
            OrchestratorMetrics metrics,
            OrchestratorConfig config,
            Clock clock) {
        this.jobRepository = jobRepository;
        this.executionRepository = executionRepository;
        this.metricRepository = metricRepository;
        this.cron = cron;
        this.locks = locks;
        this.metrics = metrics;
        this.defaultMaxRetries = config.defaultMaxRetries();
        this.clock = clock;
    }

    /**
     * Register a new job in {@code pending}.
     *
     * @param maxRetries null for the configured default
     * @throws ValidationException    if a field is missing or malformed
     * @throws DuplicateNameException if a job with the same name exists
     */
    public Job register(String name, String image, List<String> command, String schedule, Integer maxRetries,
            String checkpointPath) {
        String cleanName = validName(name);
        String cleanImage = required(image, "image");
        List<String> cleanCommand = validCommand(command);
        String cleanSchedule = validSchedule(schedule);
        int retries = validMaxRetries(maxRetries != null ? maxRetries : defaultMaxRetries);

        Instant now = clock.instant();
        Job job = Job.builder()
                .id(jobRepository.generateId())
                .name(cleanName)
                .image(cleanImage)
                .command(cleanCommand)
                .schedule(cleanSchedule)
                .maxRetries(retries)
                .retryCount(0)
                .checkpointPath(optional(checkpointPath))
                .status(JobStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();

        synchronized (nameLock) {
            if (jobRepository.findByName(cleanName).isPresent()) {
                throw new DuplicateNameException(cleanName);
            }
            try {
                jobRepository.save(job);
            } catch (IllegalStateException e) {
                if (e.getCause() instanceof SQLIntegrityConstraintViolationException) {
                    throw new DuplicateNameException(cleanName);
                }
                throw e;
            }
        }

        metrics.jobRegistered(job);
        log.info("Registered job {}: {} ({})", job.id(), job.name(), job.schedule());
        return job;
    }

    /**
     * @throws NotFoundException if the job does not exist
     */
    public Job get(String jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> new NotFoundException(jobId));
    }

    /**
     * One page of jobs, newest first.
     *
     * @param status   optional filter, null for all
     * @param page     1-based page number
     * @param pageSize 1..100
     */
    public JobPage list(JobStatus status, int page, int pageSize) {
        if (page < 1) {
            throw new ValidationException("page must be >= 1");
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new ValidationException("page_size must be within 1.." + MAX_PAGE_SIZE);
        }

        int total = jobRepository.count(status);
        List<Job> jobs = jobRepository.findPage(status, (page - 1) * pageSize, pageSize);
        return new JobPage(jobs, total, page, pageSize);
    }

    /**
     * Apply a partial update. Lowering maxRetries below the current retry
     * count clamps the retry count.
     *
     * @throws NotFoundException   if the job does not exist
     * @throws ConflictException   if the job is running
     * @throws ValidationException if a field is malformed
     */
    public Job update(String jobId, JobUpdate update) {
        return locks.withLock(jobId, () -> {
            Job job = get(jobId);
            if (job.status() == JobStatus.RUNNING) {
                throw new ConflictException("Cannot update job " + jobId + " while it is running");
            }
            if (update.isEmpty()) {
                return job;
            }

            Job.Builder builder = job.toBuilder().updatedAt(clock.instant());
            if (update.image() != null) {
                builder.image(required(update.image(), "image"));
            }
            if (update.command() != null) {
                builder.command(validCommand(update.command()));
            }
            if (update.schedule() != null) {
                builder.schedule(validSchedule(update.schedule()));
            }
            if (update.maxRetries() != null) {
                int maxRetries = validMaxRetries(update.maxRetries());
                builder.maxRetries(maxRetries).retryCount(Math.min(job.retryCount(), maxRetries));
            }
            if (update.checkpointPath() != null) {
                builder.checkpointPath(optional(update.checkpointPath()));
            }

            if (update.name() != null) {
                String name = validName(update.name());
                builder.name(name);
                synchronized (nameLock) {
                    jobRepository.findByName(name)
                            .filter(other -> !other.id().equals(jobId))
                            .ifPresent(other -> {
                                throw new DuplicateNameException(name);
                            });
                    return save(builder.build());
                }
            }
            return save(builder.build());
        });
    }

    /**
     * Delete a job and its execution history.
     *
     * @throws NotFoundException if the job does not exist
     * @throws ConflictException if the job is running
     */
    public void delete(String jobId) {
        locks.withLock(jobId, () -> {
            Job job = get(jobId);
            if (job.status() == JobStatus.RUNNING) {
                throw new ConflictException("Cannot delete job " + jobId + " while it is running");
            }
            jobRepository.delete(jobId);
            log.info("Deleted job {}: {}", jobId, job.name());
        });
        locks.forget(jobId);
    }

    /**
     * Re-arm a finished job: back to {@code pending} with retries and error
     * cleared. Execution numbering continues where it left off.
     *
     * @throws NotFoundException if the job does not exist
     * @throws ConflictException unless the job is failed or completed
     */
    public Job manualRetry(String jobId) {
        return locks.withLock(jobId, () -> {
            Job job = get(jobId);
            if (job.status() != JobStatus.FAILED && job.status() != JobStatus.COMPLETED) {
                throw new ConflictException("Job " + jobId + " is " + job.status().value()
                        + "; only failed or completed jobs can be retried");
            }

            Job rearmed = job.toBuilder()
                    .status(JobStatus.PENDING)
                    .retryCount(0)
                    .errorMessage(null)
                    .lastStartedAt(null)
                    .lastCompletedAt(null)
                    .updatedAt(clock.instant())
                    .build();
            save(rearmed);
            log.info("Job {} manually re-armed", jobId);
            return rearmed;
        });
    }

    /**
     * Execution history of a job, oldest first.
     *
     * @throws NotFoundException if the job does not exist
     */
    public List<Execution> executions(String jobId) {
        get(jobId);
        return executionRepository.findByJobId(jobId);
    }

    /**
     * Metric samples recorded for a job, oldest first.
     *
     * @throws NotFoundException if the job does not exist
     */
    public List<MetricSample> metrics(String jobId) {
        get(jobId);
        return metricRepository.findByJobId(jobId);
    }

    // --- Helpers ---

    private Job save(Job job) {
        try {
            jobRepository.update(job);
        } catch (IllegalStateException e) {
            if (e.getCause() instanceof SQLIntegrityConstraintViolationException) {
                throw new DuplicateNameException(job.name());
            }
            throw e;
        }
        return job;
    }

    private static String validName(String name) {
        String trimmed = required(name, "name");
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        return trimmed;
    }

    private static List<String> validCommand(List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new ValidationException("command must not be empty");
        }
        if (command.stream().anyMatch(arg -> arg == null)) {
            throw new ValidationException("command must not contain null arguments");
        }
        return List.copyOf(command);
    }

    private String validSchedule(String schedule) {
        String trimmed = required(schedule, "schedule");
        cron.validate(trimmed);
        return trimmed;
    }

    private static int validMaxRetries(int maxRetries) {
        if (maxRetries < 0 || maxRetries > MAX_RETRIES_LIMIT) {
            throw new ValidationException("max_retries must be within 0.." + MAX_RETRIES_LIMIT);
        }
        return maxRetries;
    }

    private static String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        return value.trim();
    }

    private static String optional(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
