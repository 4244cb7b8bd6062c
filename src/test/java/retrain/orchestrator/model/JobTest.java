package retrain.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobTest {

    private static Job.Builder minimal() {
        return Job.builder()
                .id("train-1")
                .name("job")
                .image("img")
                .command(List.of("train"))
                .schedule("0 2 * * *")
                .maxRetries(3)
                .status(JobStatus.PENDING);
    }

    @Test
    void retryCountMustStayWithinMax() {
        assertThrows(IllegalArgumentException.class, () -> minimal().retryCount(4).build());
        assertThrows(IllegalArgumentException.class, () -> minimal().retryCount(-1).build());
        assertThrows(IllegalArgumentException.class, () -> minimal().maxRetries(-1).build());
        assertEquals(3, minimal().retryCount(3).build().retryCount());
    }

    @Test
    void requiredFieldsAreEnforced() {
        assertThrows(NullPointerException.class, () -> minimal().image(null).build());
        assertThrows(NullPointerException.class, () -> minimal().status(null).build());
    }

    @Test
    void commandIsCopied() {
        List<String> command = new ArrayList<>(List.of("python", "train.py"));
        Job job = minimal().command(command).build();

        command.add("--evil");

        assertEquals(List.of("python", "train.py"), job.command());
        assertThrows(UnsupportedOperationException.class, () -> job.command().add("x"));
    }

    @Test
    void scheduleAnchorPrefersLastCheck() {
        Instant created = Instant.parse("2024-01-01T00:00:00Z");
        Instant checked = Instant.parse("2024-01-01T05:00:00Z");

        assertEquals(created, minimal().createdAt(created).build().scheduleAnchor());
        assertEquals(checked, minimal().createdAt(created).lastCheckedAt(checked).build().scheduleAnchor());
    }

    @Test
    void canRetryUntilBudgetUsed() {
        assertTrue(minimal().retryCount(2).build().canRetry());
        assertFalse(minimal().retryCount(3).build().canRetry());
    }

    @Test
    void blankCheckpointIsNoCheckpoint() {
        assertFalse(minimal().checkpointPath("  ").build().hasCheckpoint());
        assertTrue(minimal().checkpointPath("/ckpt").build().hasCheckpoint());
    }

    @Test
    void statusValues() {
        assertEquals("retrying", JobStatus.RETRYING.value());
        assertEquals(JobStatus.FAILED, JobStatus.fromValue("FaIlEd"));
        assertThrows(IllegalArgumentException.class, () -> JobStatus.fromValue("paused"));
        assertTrue(JobStatus.RETRYING.isLaunchable());
        assertFalse(JobStatus.COMPLETED.isLaunchable());
        assertTrue(JobStatus.COMPLETED.isTerminal());
        assertFalse(JobStatus.RETRYING.isTerminal());
    }
}
