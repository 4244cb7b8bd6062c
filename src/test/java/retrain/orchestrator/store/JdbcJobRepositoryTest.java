package retrain.orchestrator.store;

import retrain.orchestrator.config.OrchestratorConfig;
import retrain.orchestrator.model.Execution;
import retrain.orchestrator.model.ExecutionStatus;
import retrain.orchestrator.model.Job;
import retrain.orchestrator.model.JobStatus;
import org.junit.jupiter.api.*;

import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobRepositoryTest {

    private static Database db;
    private static JdbcJobRepository repo;
    private static JdbcExecutionRepository executions;

    @BeforeAll
    static void setup() {
        OrchestratorConfig config = OrchestratorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-jobs;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        repo = new JdbcJobRepository(db);
        executions = new JdbcExecutionRepository(db);
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
            st.execute("DELETE FROM jobs");
            conn.commit();
        }
    }

    private static Job job(String id, String name, JobStatus status, Instant created) {
        return Job.builder()
                .id(id)
                .name(name)
                .image("trainer:latest")
                .command(List.of("python", "train.py", "--lr", "0.01"))
                .schedule("0 2 * * *")
                .maxRetries(3)
                .checkpointPath("/ckpt/" + name)
                .status(status)
                .createdAt(created)
                .updatedAt(created)
                .build();
    }

    @Test
    void saveAndFindById() {
        Instant created = Instant.parse("2024-01-01T00:00:00Z");
        repo.save(job("train-1", "resnet", JobStatus.PENDING, created));

        Optional<Job> found = repo.findById("train-1");
        assertTrue(found.isPresent());
        assertEquals("resnet", found.get().name());
        assertEquals(List.of("python", "train.py", "--lr", "0.01"), found.get().command());
        assertEquals("/ckpt/resnet", found.get().checkpointPath());
        assertEquals(JobStatus.PENDING, found.get().status());
        assertEquals(created, found.get().createdAt());
        assertNull(found.get().lastCheckedAt());
    }

    @Test
    void findByName() {
        repo.save(job("train-1", "resnet", JobStatus.PENDING, Instant.now()));

        assertEquals("train-1", repo.findByName("resnet").orElseThrow().id());
        assertTrue(repo.findByName("missing").isEmpty());
    }

    @Test
    void duplicateNameViolatesConstraint() {
        repo.save(job("train-1", "resnet", JobStatus.PENDING, Instant.now()));

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> repo.save(job("train-2", "resnet", JobStatus.PENDING, Instant.now())));
        assertInstanceOf(SQLIntegrityConstraintViolationException.class, e.getCause());
    }

    @Test
    void updatePersistsState() {
        Job saved = job("train-1", "resnet", JobStatus.PENDING, Instant.parse("2024-01-01T00:00:00Z"));
        repo.save(saved);

        Instant now = Instant.parse("2024-01-01T02:00:00Z");
        assertTrue(repo.update(saved.toBuilder()
                .status(JobStatus.RETRYING)
                .retryCount(1)
                .errorMessage("OOM")
                .lastStartedAt(now)
                .lastCheckedAt(now)
                .updatedAt(now)
                .build()));

        Job found = repo.findById("train-1").orElseThrow();
        assertEquals(JobStatus.RETRYING, found.status());
        assertEquals(1, found.retryCount());
        assertEquals("OOM", found.errorMessage());
        assertEquals(now, found.lastCheckedAt());
    }

    @Test
    void updateOfMissingJobReturnsFalse() {
        assertFalse(repo.update(job("ghost", "ghost", JobStatus.PENDING, Instant.now())));
    }

    @Test
    void pagesNewestFirstWithFilter() {
        Instant base = Instant.parse("2024-01-01T00:00:00Z");
        for (int i = 0; i < 5; i++) {
            JobStatus status = i % 2 == 0 ? JobStatus.PENDING : JobStatus.FAILED;
            repo.save(job("train-" + i, "job-" + i, status, base.plusSeconds(i)));
        }

        List<Job> firstPage = repo.findPage(null, 0, 2);
        assertEquals(List.of("train-4", "train-3"), firstPage.stream().map(Job::id).toList());
        assertEquals(List.of("train-0"), repo.findPage(null, 4, 2).stream().map(Job::id).toList());

        List<Job> pending = repo.findPage(JobStatus.PENDING, 0, 10);
        assertEquals(List.of("train-4", "train-2", "train-0"), pending.stream().map(Job::id).toList());
        assertEquals(3, repo.count(JobStatus.PENDING));
        assertEquals(5, repo.count(null));
    }

    @Test
    void countByStatus() {
        repo.save(job("a", "a", JobStatus.PENDING, Instant.now()));
        repo.save(job("b", "b", JobStatus.PENDING, Instant.now()));
        repo.save(job("c", "c", JobStatus.COMPLETED, Instant.now()));

        Map<JobStatus, Integer> counts = repo.countByStatus();
        assertEquals(2, counts.get(JobStatus.PENDING));
        assertEquals(1, counts.get(JobStatus.COMPLETED));
        assertNull(counts.get(JobStatus.FAILED));
    }

    @Test
    void deleteRemovesExecutions() {
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        repo.save(job("train-1", "resnet", JobStatus.COMPLETED, now));
        executions.append(Execution.builder()
                .jobId("train-1")
                .executionNumber(1)
                .status(ExecutionStatus.RUNNING)
                .startedAt(now)
                .build());

        assertTrue(repo.delete("train-1"));
        assertFalse(repo.delete("train-1"));
        assertTrue(repo.findById("train-1").isEmpty());
        assertTrue(executions.findByJobId("train-1").isEmpty());
    }

    @Test
    void generatedIdsAreUnique() {
        String first = repo.generateId();
        assertTrue(first.startsWith("train-"));
        assertNotEquals(first, repo.generateId());
    }
}
