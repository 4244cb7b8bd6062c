package retrain.orchestrator.store;

import retrain.orchestrator.model.Execution;
import retrain.orchestrator.model.ExecutionStatus;
import retrain.orchestrator.model.MetricSample;
import retrain.orchestrator.model.NotificationRecord;
import retrain.orchestrator.testing.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcExecutionRepositoryTest {

    private static final Instant START = Instant.parse("2024-01-01T01:00:00Z");

    private static Database db;
    private static JdbcExecutionRepository repo;

    @BeforeAll
    static void setup() {
        db = TestDatabases.create("executions");
        repo = new JdbcExecutionRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTables() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM job_executions");
            st.execute("DELETE FROM metrics");
            st.execute("DELETE FROM notifications");
            conn.commit();
        }
    }

    private static Execution running(int number) {
        return Execution.builder()
                .jobId("train-1")
                .executionNumber(number)
                .status(ExecutionStatus.RUNNING)
                .startedAt(START)
                .checkpointUsed("/ckpt")
                .build();
    }

    @Test
    void numberingStartsAtOne() {
        assertEquals(0, repo.lastExecutionNumber("train-1"));

        repo.append(running(1));

        assertEquals(1, repo.lastExecutionNumber("train-1"));
        assertEquals(0, repo.lastExecutionNumber("train-2"));
    }

    @Test
    void duplicateNumberIsRejected() {
        repo.append(running(1));

        assertThrows(IllegalStateException.class, () -> repo.append(running(1)));
    }

    @Test
    void discardOnlyRemovesUnsubmittedRunningExecution() {
        repo.append(running(1));
        repo.append(running(2));
        assertTrue(repo.attachHandle("train-1", 2, "container-abc"));

        assertFalse(repo.discard("train-1", 2));
        assertTrue(repo.discard("train-1", 1));
        assertFalse(repo.discard("train-1", 1));

        assertEquals(List.of(2), repo.findByJobId("train-1").stream().map(Execution::executionNumber).toList());
    }

    @Test
    void attachHandleAndFinish() {
        repo.append(running(1));
        assertTrue(repo.attachHandle("train-1", 1, "container-abc"));

        Execution current = repo.findRunning("train-1").orElseThrow();
        assertEquals("container-abc", current.backendHandle());
        assertEquals(1, repo.countRunning("train-1"));

        assertTrue(repo.finish(current.finish(ExecutionStatus.FAILED, START.plusSeconds(90), "exit code 1")));

        assertTrue(repo.findRunning("train-1").isEmpty());
        Execution stored = repo.findByJobId("train-1").get(0);
        assertEquals(ExecutionStatus.FAILED, stored.status());
        assertEquals(90L, stored.durationSeconds());
        assertEquals("exit code 1", stored.errorMessage());
        assertEquals("/ckpt", stored.checkpointUsed());
    }

    @Test
    void terminalRowsAreNeverRewritten() {
        repo.append(running(1));
        Execution done = running(1).finish(ExecutionStatus.COMPLETED, START.plusSeconds(5), null);
        assertTrue(repo.finish(done));

        assertFalse(repo.finish(running(1).finish(ExecutionStatus.FAILED, START.plusSeconds(9), "late")));
        assertFalse(repo.attachHandle("train-1", 1, "late-handle"));

        Execution stored = repo.findByJobId("train-1").get(0);
        assertEquals(ExecutionStatus.COMPLETED, stored.status());
        assertNull(stored.backendHandle());
    }

    @Test
    void finishRequiresTerminalStatus() {
        assertThrows(IllegalArgumentException.class, () -> repo.finish(running(1)));
    }

    @Test
    void historyIsOrderedByNumber() {
        repo.append(running(1));
        repo.finish(running(1).finish(ExecutionStatus.FAILED, START.plusSeconds(1), "a"));
        repo.append(running(2));

        List<Execution> history = repo.findByJobId("train-1");
        assertEquals(List.of(1, 2), history.stream().map(Execution::executionNumber).toList());
        assertNull(history.get(1).completedAt());
    }

    @Test
    void metricsAndNotificationsAreAppendOnly() {
        JdbcMetricRepository metrics = new JdbcMetricRepository(db);
        JdbcNotificationRepository notifications = new JdbcNotificationRepository(db);

        metrics.record(new MetricSample("train-1", MetricSample.RETRY_COUNT, 2, START));
        metrics.record(new MetricSample("train-1", MetricSample.EXECUTION_DURATION_SECONDS, 61.5, START));
        notifications.append(NotificationRecord.failed("slack", "train-1", "msg", "timeout", START));

        List<MetricSample> samples = metrics.findByJobId("train-1");
        assertEquals(2, samples.size());
        assertEquals(61.5, samples.get(1).value());
        assertEquals(START, samples.get(0).recordedAt());

        NotificationRecord record = notifications.findByJobId("train-1").get(0);
        assertFalse(record.success());
        assertEquals("timeout", record.errorMessage());
        assertEquals("failed", record.status());
    }
}
