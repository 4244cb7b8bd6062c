package retrain.orchestrator.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import retrain.orchestrator.model.Job;
import retrain.orchestrator.model.JobStatus;
import retrain.orchestrator.testing.Engine;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerTest {

    private Engine engine;
    private Scheduler scheduler;

    @BeforeEach
    void setUp() {
        engine = new Engine("scheduler");
        scheduler = new Scheduler(engine.ticker, Duration.ofMillis(50));
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
        engine.close();
    }

    @Test
    void launchesDueJobsInBackground() throws Exception {
        Job job = engine.hourlyJob("background", 1);
        engine.clock.set(Instant.parse("2024-01-01T01:00:00Z"));

        scheduler.start();
        assertTrue(scheduler.isRunning());

        long deadline = System.currentTimeMillis() + 5000;
        while (engine.reload(job).status() != JobStatus.RUNNING && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertEquals(JobStatus.RUNNING, engine.reload(job).status());
        assertEquals(1, engine.backend.submissions().size());
    }

    @Test
    void stopIsIdempotent() {
        scheduler.start();
        scheduler.stop();
        scheduler.stop();

        assertFalse(scheduler.isRunning());
    }
}
