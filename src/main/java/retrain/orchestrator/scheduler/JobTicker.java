package retrain.orchestrator.scheduler;

import retrain.orchestrator.backend.ExecutionBackend;
import retrain.orchestrator.backend.PollResult;
import retrain.orchestrator.cron.CronEvaluator;
import retrain.orchestrator.error.BackendException;
import retrain.orchestrator.metrics.OrchestratorMetrics;
import retrain.orchestrator.model.Execution;
import retrain.orchestrator.model.ExecutionStatus;
import retrain.orchestrator.model.Job;
import retrain.orchestrator.model.JobStatus;
import retrain.orchestrator.model.MetricSample;
import retrain.orchestrator.notify.NotificationDispatcher;
import retrain.orchestrator.repository.ExecutionRepository;
import retrain.orchestrator.repository.JobRepository;
import retrain.orchestrator.repository.MetricRepository;
import retrain.orchestrator.repository.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One scheduler tick: launch due jobs, then poll the ones already running.
 *
 * <p>Each tick works from a single snapshot of the registry. Jobs that were
 * not running when the snapshot was taken are considered for launch; jobs
 * that were running are polled. A job is therefore evaluated at most once per
 * tick, and a job launched in this tick is first polled in the next one.
 *
 * <p>Every state change happens under the job's lock, and the execution and
 * job rows it touches are committed together. Backend calls are made with the
 * lock released and are bounded by {@code backendTimeout}: lock, decide,
 * unlock, call, lock, re-read, commit. A backend call that fails or times out
 * never changes a job's outcome; only a result the backend reports does.
 */
public class JobTicker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(JobTicker.class);

    private final JobRepository jobRepository;
    private final ExecutionRepository executionRepository;
    private final MetricRepository metricRepository;
    private final UnitOfWork unitOfWork;
    private final OrchestratorMetrics metrics;
    private final ExecutionBackend backend;
    private final CronEvaluator cron;
    private final RetryPolicy retryPolicy;
    private final NotificationDispatcher notifications;
    private final JobLocks locks;
    private final ExecutorService backendExecutor;
    private final Duration backendTimeout;
    private final Clock clock;

    public JobTicker(JobRepository jobRepository,
            ExecutionRepository executionRepository,
            MetricRepository metricRepository,
            UnitOfWork unitOfWork,
            OrchestratorMetrics metrics,
            ExecutionBackend backend,
            CronEvaluator cron,
            RetryPolicy retryPolicy,
            NotificationDispatcher notifications,
            JobLocks locks,
            ExecutorService backendExecutor,
            Duration backendTimeout,
            Clock clock) {
        this.jobRepository = jobRepository;
        this.executionRepository = executionRepository;
        this.metricRepository = metricRepository;
        this.unitOfWork = unitOfWork;
        this.metrics = metrics;
        this.backend = backend;
        this.cron = cron;
        this.retryPolicy = retryPolicy;
        this.notifications = notifications;
        this.locks = locks;
        this.backendExecutor = backendExecutor;
        this.backendTimeout = backendTimeout;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            TickResult result = tick();
            if (result.hasActivity()) {
                log.info("Tick: {} launched, {} finished, {} polled", result.launched(), result.finished(),
                        result.polled());
            }
        } catch (Exception e) {
            log.error("Scheduler tick error", e);
        }
    }

    /**
     * Run a single tick.
     *
     * @return what the tick did
     */
    public TickResult tick() {
        Instant now = clock.instant();
        List<Job> snapshot = jobRepository.findAll();

        int launched = 0;
        for (Job job : snapshot) {
            if (job.status() == JobStatus.RUNNING) {
                continue;
            }
            try {
                if (launch(job.id(), now)) {
                    launched++;
                }
            } catch (Exception e) {
                log.error("Failed to launch job {}", job.id(), e);
            }
        }

        int polled = 0;
        int finished = 0;
        for (Job job : snapshot) {
            if (job.status() != JobStatus.RUNNING) {
                continue;
            }
            polled++;
            try {
                if (poll(job.id())) {
                    finished++;
                }
            } catch (Exception e) {
                log.error("Failed to poll job {}", job.id(), e);
            }
        }

        return new TickResult(launched, polled, finished);
    }

    // --- Launch ---

    private boolean launch(String jobId, Instant now) {
        LaunchPlan plan = locks.withLock(jobId, () -> unitOfWork.inTransaction(() -> reserveExecution(jobId, now)));
        if (plan == null) {
            return false;
        }

        String handle;
        try {
            handle = callBackend(() -> backend.submit(jobId, plan.executionNumber(), plan.image(), plan.command(),
                    plan.checkpointPath()));
        } catch (BackendException e) {
            log.warn("Submit of job {} execution #{} inconclusive, will resubmit: {}", jobId,
                    plan.executionNumber(), e.getMessage());
            locks.withLock(jobId, () -> unitOfWork.inTransaction(() -> cancelReservation(jobId, plan)));
            return false;
        }

        locks.withLock(jobId, () -> {
            if (!executionRepository.attachHandle(jobId, plan.executionNumber(), handle)) {
                log.warn("Execution {}#{} closed before its handle was recorded", jobId, plan.executionNumber());
            }
        });
        log.info("Launched job {} execution #{} (handle {})", jobId, plan.executionNumber(), handle);
        return true;
    }

    /**
     * Under the job lock, in one transaction: check eligibility, append the
     * running execution and move the job to RUNNING.
     */
    private LaunchPlan reserveExecution(String jobId, Instant now) {
        Job job = jobRepository.findById(jobId).orElse(null);
        if (job == null || !retryPolicy.isEligible(job, now, cron)) {
            return null;
        }

        if (executionRepository.countRunning(jobId) > 0) {
            log.warn("Job {} is {} but already has a running execution, not launching", jobId, job.status());
            return null;
        }

        int executionNumber = executionRepository.lastExecutionNumber(jobId) + 1;
        executionRepository.append(Execution.builder()
                .jobId(jobId)
                .executionNumber(executionNumber)
                .status(ExecutionStatus.RUNNING)
                .startedAt(now)
                .checkpointUsed(job.checkpointPath())
                .build());

        jobRepository.update(job.toBuilder()
                .status(JobStatus.RUNNING)
                .lastStartedAt(now)
                .lastCheckedAt(now)
                .updatedAt(now)
                .build());

        return new LaunchPlan(job, executionNumber, job.image(), retryPolicy.commandFor(job),
                retryPolicy.checkpointFor(job));
    }

    /**
     * Under the job lock, in one transaction: undo a reservation whose submit
     * had no definite outcome. The job gets back the status and schedule
     * anchor it had, so the next tick submits the same execution number again.
     */
    private Void cancelReservation(String jobId, LaunchPlan plan) {
        if (!executionRepository.discard(jobId, plan.executionNumber())) {
            return null;
        }
        Job previous = plan.job();
        jobRepository.findById(jobId)
                .filter(job -> job.status() == JobStatus.RUNNING)
                .ifPresent(job -> jobRepository.update(job.toBuilder()
                        .status(previous.status())
                        .lastStartedAt(previous.lastStartedAt())
                        .lastCheckedAt(previous.lastCheckedAt())
                        .updatedAt(clock.instant())
                        .build()));
        return null;
    }

    // --- Poll ---

    /**
     * @return true if the job's running execution reached a terminal state
     */
    private boolean poll(String jobId) {
        Execution running = locks.withLock(jobId, () -> {
            Job job = jobRepository.findById(jobId).orElse(null);
            if (job == null || job.status() != JobStatus.RUNNING) {
                return null;
            }
            return executionRepository.findRunning(jobId).orElse(null);
        });

        if (running == null) {
            return locks.withLock(jobId, () -> failOrphan(jobId));
        }

        PollResult result = observe(jobId, running);
        if (result == null || result.isRunning()) {
            return false;
        }
        if (!locks.withLock(jobId, () -> completeRunning(jobId, running.executionNumber(), result))) {
            return false;
        }
        if (running.backendHandle() != null) {
            release(jobId, running);
        }
        return true;
    }

    /**
     * Ask the backend about a running execution.
     *
     * @return the observed result, or null if the poll was inconclusive
     */
    private PollResult observe(String jobId, Execution running) {
        if (running.backendHandle() == null) {
            return PollResult.failed("Execution was never submitted to the backend");
        }
        try {
            return callBackend(() -> backend.poll(running.backendHandle()));
        } catch (BackendException e) {
            log.warn("Poll of job {} execution #{} inconclusive: {}", jobId, running.executionNumber(),
                    e.getMessage());
            return null;
        }
    }

    private void release(String jobId, Execution finished) {
        try {
            callBackend(() -> {
                backend.release(finished.backendHandle());
                return null;
            });
        } catch (BackendException e) {
            log.warn("Failed to release job {} execution #{}: {}", jobId, finished.executionNumber(),
                    e.getMessage());
        }
    }

    /**
     * Under the job lock: close the execution and apply the job transition in
     * one transaction, then report it.
     */
    private boolean completeRunning(String jobId, int executionNumber, PollResult result) {
        Transition transition = unitOfWork.inTransaction(() -> closeExecution(jobId, executionNumber, result));
        if (transition == null) {
            return false;
        }
        recordMetrics(transition.job(), transition.execution(), clock.instant());
        notifications.dispatch(transition.job(), message(transition.job(), transition.execution()));
        return true;
    }

    private Transition closeExecution(String jobId, int executionNumber, PollResult result) {
        Instant now = clock.instant();
        Job job = jobRepository.findById(jobId).orElse(null);
        if (job == null || job.status() != JobStatus.RUNNING) {
            return null;
        }
        Execution execution = executionRepository.findRunning(jobId).orElse(null);
        if (execution == null || execution.executionNumber() != executionNumber) {
            return null;
        }

        boolean succeeded = result.state() == PollResult.State.SUCCEEDED;
        Execution terminal = succeeded
                ? execution.finish(ExecutionStatus.COMPLETED, now, null)
                : execution.finish(ExecutionStatus.FAILED, now, result.error());
        if (!executionRepository.finish(terminal)) {
            return null;
        }

        Job updated = succeeded ? onSuccess(job, now) : onFailure(job, result.error(), now);
        jobRepository.update(updated);
        return new Transition(updated, terminal);
    }

    private boolean failOrphan(String jobId) {
        Instant now = clock.instant();
        Job job = jobRepository.findById(jobId).orElse(null);
        if (job == null || job.status() != JobStatus.RUNNING || executionRepository.findRunning(jobId).isPresent()) {
            return false;
        }
        log.warn("Job {} is running without a running execution", jobId);
        Job updated = onFailure(job, "Execution record missing", now);
        jobRepository.update(updated);
        if (updated.status() == JobStatus.RETRYING) {
            metrics.retryScheduled(updated);
        }
        notifications.dispatch(updated, message(updated, null));
        return true;
    }

    private Job onSuccess(Job job, Instant now) {
        log.info("Job {} completed", job.id());
        return job.toBuilder()
                .status(JobStatus.COMPLETED)
                .retryCount(0)
                .lastCompletedAt(now)
                .errorMessage(null)
                .updatedAt(now)
                .build();
    }

    private Job onFailure(Job job, String error, Instant now) {
        RetryDecision decision = retryPolicy.decide(job.retryCount(), job.maxRetries(), error);
        Job.Builder next = job.toBuilder()
                .lastCompletedAt(now)
                .errorMessage(error)
                .updatedAt(now);

        if (decision == RetryDecision.RETRY_WITH_CHECKPOINT) {
            int attempt = job.retryCount() + 1;
            log.info("Job {} failed, retry {}/{} scheduled: {}", job.id(), attempt, job.maxRetries(), error);
            return next.status(JobStatus.RETRYING).retryCount(attempt).build();
        }

        log.warn("Job {} permanently failed after {} retries: {}", job.id(), job.maxRetries(), error);
        return next.status(JobStatus.FAILED).build();
    }

    private void recordMetrics(Job job, Execution terminal, Instant now) {
        metrics.executionFinished(job, terminal);
        if (job.status() == JobStatus.RETRYING) {
            metrics.retryScheduled(job);
        }
        try {
            if (terminal.durationSeconds() != null) {
                metricRepository.record(new MetricSample(job.id(), MetricSample.EXECUTION_DURATION_SECONDS,
                        terminal.durationSeconds(), now));
            }
            metricRepository.record(new MetricSample(job.id(), MetricSample.RETRY_COUNT, job.retryCount(), now));
        } catch (Exception e) {
            log.warn("Failed to record metrics for job {}: {}", job.id(), e.getMessage());
        }
    }

    static String message(Job job, Execution terminal) {
        return switch (job.status()) {
            case COMPLETED -> "Training job completed successfully in "
                    + formatDuration(terminal != null ? terminal.durationSeconds() : null);
            case RETRYING -> "Job failed, retrying (attempt " + job.retryCount() + "/" + job.maxRetries() + "): "
                    + job.errorMessage();
            case FAILED -> "Job failed after " + job.maxRetries() + " retries: " + job.errorMessage();
            default -> "Job " + job.status().value();
        };
    }

    /** H:MM:SS, or N/A when unknown */
    static String formatDuration(Long seconds) {
        if (seconds == null) {
            return "N/A";
        }
        return String.format("%d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }

    // --- Backend calls ---

    private <T> T callBackend(Callable<T> call) {
        Future<T> future = backendExecutor.submit(call);
        try {
            return future.get(backendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new BackendException("Backend call timed out after " + backendTimeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new BackendException("Interrupted waiting for backend", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BackendException backendException) {
                throw backendException;
            }
            throw new BackendException("Backend call failed: " + cause.getMessage(), cause);
        }
    }

    private record LaunchPlan(Job job, int executionNumber, String image, List<String> command,
            String checkpointPath) {
    }

    private record Transition(Job job, Execution execution) {
    }

    /** Counts for one tick */
    public record TickResult(int launched, int polled, int finished) {

        public boolean hasActivity() {
            return launched > 0 || finished > 0;
        }
    }
}
