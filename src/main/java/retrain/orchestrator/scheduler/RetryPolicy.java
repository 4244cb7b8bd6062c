package retrain.orchestrator.scheduler;

import retrain.orchestrator.cron.CronEvaluator;
import retrain.orchestrator.model.Job;
import retrain.orchestrator.model.JobStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides what happens after a failed execution and when a job may launch.
 *
 * <p>A failure is retried while {@code retryCount < maxRetries}; maxRetries=0
 * means a single attempt. Retries always reuse the job's configured
 * checkpoint path; there is only ever one checkpoint generation per job.
 */
public final class RetryPolicy {

    static final String RESUME_FLAG = "--resume-from-checkpoint";

    private final RetryMode mode;
    private final Duration backoffBase;
    private final Duration backoffMax;

    public RetryPolicy(RetryMode mode, Duration backoffBase, Duration backoffMax) {
        this.mode = mode;
        this.backoffBase = backoffBase;
        this.backoffMax = backoffMax;
    }

    public static RetryPolicy onSchedule() {
        return new RetryPolicy(RetryMode.ON_SCHEDULE, Duration.ofSeconds(60), Duration.ofHours(1));
    }

    public RetryMode mode() {
        return mode;
    }

    /**
     * @param retryCount retries already consumed
     * @param maxRetries retries allowed
     * @param error      failure reason, informational only
     */
    public RetryDecision decide(int retryCount, int maxRetries, String error) {
        return retryCount < maxRetries
                ? RetryDecision.RETRY_WITH_CHECKPOINT
                : RetryDecision.TERMINAL_FAILURE;
    }

    /** Checkpoint path handed to the backend for the job's next attempt */
    public String checkpointFor(Job job) {
        return job.hasCheckpoint() ? job.checkpointPath() : null;
    }

    /**
     * Command for the next attempt. Retries of a job with a checkpoint resume
     * from it.
     */
    public List<String> commandFor(Job job) {
        if (job.retryCount() == 0 || !job.hasCheckpoint()) {
            return job.command();
        }
        List<String> command = new ArrayList<>(job.command());
        command.add(RESUME_FLAG);
        command.add(job.checkpointPath());
        return command;
    }

    /** Delay before retry number {@code retryCount} in BACKOFF mode */
    public Duration backoff(int retryCount) {
        int exponent = Math.min(Math.max(retryCount, 0), 30);
        Duration delay = backoffBase.multipliedBy(1L << exponent);
        return delay.compareTo(backoffMax) > 0 ? backoffMax : delay;
    }

    /**
     * Whether a PENDING or RETRYING job should launch at {@code now}.
     */
    public boolean isEligible(Job job, Instant now, CronEvaluator cron) {
        if (!job.status().isLaunchable()) {
            return false;
        }
        if (job.status() == JobStatus.RETRYING && mode == RetryMode.BACKOFF) {
            Instant failedAt = job.lastCompletedAt() != null ? job.lastCompletedAt() : job.scheduleAnchor();
            return !failedAt.plus(backoff(job.retryCount())).isAfter(now);
        }
        return cron.isDue(job.schedule(), job.scheduleAnchor(), now);
    }
}
