package retrain.orchestrator.simulation;

import retrain.orchestrator.backend.ExecutionBackend;
import retrain.orchestrator.backend.PollResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * In-process backend for local runs without a container engine.
 * Each attempt "runs" for a random duration, then succeeds or fails with the
 * configured probability.
 */
public final class SimulatedExecutionBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(SimulatedExecutionBackend.class);

    private final Clock clock;
    private final Duration durationMin;
    private final Duration durationMax;
    private final double failRate;
    private final Map<String, SimulatedRun> runs = new ConcurrentHashMap<>();

    public SimulatedExecutionBackend(Clock clock, Duration durationMin, Duration durationMax, double failRate) {
        if (failRate < 0 || failRate > 1) {
            throw new IllegalArgumentException("failRate must be within 0..1");
        }
        this.clock = clock;
        this.durationMin = durationMin;
        this.durationMax = durationMax;
        this.failRate = failRate;
    }

    @Override
    public String submit(String jobId, int executionNumber, String image, List<String> command,
            String checkpointPath) {
        String handle = "sim-" + jobId + "-" + executionNumber;
        if (runs.containsKey(handle)) {
            log.info("Sim {} already started, reusing it", handle);
            return handle;
        }

        long minMs = durationMin.toMillis();
        long maxMs = durationMax.toMillis();
        long runMs = minMs >= maxMs ? minMs : ThreadLocalRandom.current().nextLong(minMs, maxMs);
        boolean fails = failRate > 0 && ThreadLocalRandom.current().nextDouble() < failRate;

        runs.putIfAbsent(handle, new SimulatedRun(clock.instant().plusMillis(runMs), fails));
        log.info("Sim started {} for job {} ({}ms, command={})", handle, jobId, runMs, command);
        return handle;
    }

    @Override
    public PollResult poll(String handle) {
        SimulatedRun run = runs.get(handle);
        if (run == null) {
            // runs live in memory only; a restart loses them
            return PollResult.failed("Simulated run " + handle + " was lost");
        }
        if (clock.instant().isBefore(run.finishAt())) {
            return PollResult.running();
        }
        return run.fails() ? PollResult.failed("Simulated failure") : PollResult.succeeded();
    }

    @Override
    public void release(String handle) {
        runs.remove(handle);
    }

    @Override
    public String name() {
        return "simulated";
    }

    private record SimulatedRun(Instant finishAt, boolean fails) {
    }
}
