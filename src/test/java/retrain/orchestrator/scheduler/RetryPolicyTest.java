package retrain.orchestrator.scheduler;

import org.junit.jupiter.api.Test;
import retrain.orchestrator.cron.CronEvaluator;
import retrain.orchestrator.cron.CronUtilsEvaluator;
import retrain.orchestrator.model.Job;
import retrain.orchestrator.model.JobStatus;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private static final Instant CREATED = Instant.parse("2024-01-01T00:00:00Z");

    private final CronEvaluator cron = new CronUtilsEvaluator(ZoneOffset.UTC);
    private final RetryPolicy onSchedule = RetryPolicy.onSchedule();
    private final RetryPolicy backoff = new RetryPolicy(RetryMode.BACKOFF, Duration.ofSeconds(60),
            Duration.ofMinutes(30));

    private static Job.Builder job() {
        return Job.builder()
                .id("train-1")
                .name("job")
                .image("img")
                .command(List.of("python", "train.py"))
                .schedule("0 * * * *")
                .maxRetries(3)
                .status(JobStatus.PENDING)
                .createdAt(CREATED);
    }

    @Test
    void retriesWhileBudgetRemains() {
        assertEquals(RetryDecision.RETRY_WITH_CHECKPOINT, onSchedule.decide(0, 3, "x"));
        assertEquals(RetryDecision.RETRY_WITH_CHECKPOINT, onSchedule.decide(2, 3, "x"));
        assertEquals(RetryDecision.TERMINAL_FAILURE, onSchedule.decide(3, 3, "x"));
        assertEquals(RetryDecision.TERMINAL_FAILURE, onSchedule.decide(0, 0, "x"));
    }

    @Test
    void firstAttemptRunsPlainCommand() {
        Job first = job().checkpointPath("/ckpt").build();

        assertEquals(List.of("python", "train.py"), onSchedule.commandFor(first));
        assertEquals("/ckpt", onSchedule.checkpointFor(first));
    }

    @Test
    void retryAppendsResumeFlag() {
        Job retry = job().checkpointPath("/ckpt").retryCount(1).status(JobStatus.RETRYING).build();

        assertEquals(List.of("python", "train.py", "--resume-from-checkpoint", "/ckpt"),
                onSchedule.commandFor(retry));
        assertEquals(List.of("python", "train.py"), retry.command());
    }

    @Test
    void retryWithoutCheckpointRunsPlainCommand() {
        Job retry = job().retryCount(2).status(JobStatus.RETRYING).build();

        assertEquals(List.of("python", "train.py"), onSchedule.commandFor(retry));
        assertNull(onSchedule.checkpointFor(retry));
    }

    @Test
    void backoffDoublesUpToCap() {
        assertEquals(Duration.ofSeconds(60), backoff.backoff(0));
        assertEquals(Duration.ofSeconds(120), backoff.backoff(1));
        assertEquals(Duration.ofSeconds(480), backoff.backoff(3));
        assertEquals(Duration.ofMinutes(30), backoff.backoff(5));
        assertEquals(Duration.ofMinutes(30), backoff.backoff(1000));
    }

    @Test
    void pendingJobWaitsForFireTime() {
        Job pending = job().build();

        assertFalse(onSchedule.isEligible(pending, Instant.parse("2024-01-01T00:59:00Z"), cron));
        assertTrue(onSchedule.isEligible(pending, Instant.parse("2024-01-01T01:00:00Z"), cron));
        assertTrue(backoff.isEligible(pending, Instant.parse("2024-01-01T03:00:00Z"), cron));
    }

    @Test
    void runningAndFailedJobsAreNeverEligible() {
        Instant later = Instant.parse("2024-02-01T00:00:00Z");

        assertFalse(onSchedule.isEligible(job().status(JobStatus.RUNNING).build(), later, cron));
        assertFalse(onSchedule.isEligible(job().status(JobStatus.FAILED).build(), later, cron));
    }

    @Test
    void retryingJobFollowsMode() {
        Job retrying = job()
                .status(JobStatus.RETRYING)
                .retryCount(1)
                .lastCheckedAt(Instant.parse("2024-01-01T01:00:00Z"))
                .lastCompletedAt(Instant.parse("2024-01-01T01:10:00Z"))
                .build();

        Instant twelvePast = Instant.parse("2024-01-01T01:12:00Z");
        assertFalse(onSchedule.isEligible(retrying, twelvePast, cron));
        assertTrue(backoff.isEligible(retrying, twelvePast, cron));
        assertFalse(backoff.isEligible(retrying, Instant.parse("2024-01-01T01:11:59Z"), cron));
        assertTrue(onSchedule.isEligible(retrying, Instant.parse("2024-01-01T02:00:00Z"), cron));
    }
}
