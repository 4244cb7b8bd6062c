package retrain.orchestrator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drives the job ticker on a fixed interval.
 *
 * Uses a single-threaded executor so two ticks never overlap; a tick that
 * overruns the interval delays the next one instead of running beside it.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final JobTicker ticker;
    private final Duration tickInterval;

    private volatile boolean running = false;

    /**
     * @param ticker       tick logic
     * @param tickInterval time between tick starts
     */
    public Scheduler(JobTicker ticker, Duration tickInterval) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "retrain-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.ticker = ticker;
        this.tickInterval = tickInterval;
    }

    /**
     * Start the scheduler. The first tick runs immediately.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long intervalMs = tickInterval.toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("job-ticker", ticker),
                0,
                intervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Job ticker scheduled every {}ms", intervalMs);
    }

    /**
     * Stop the scheduler gracefully. A tick in progress may finish.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public JobTicker ticker() {
        return ticker;
    }

    /**
     * Wrap a runnable with error handling. An exception escaping a periodic
     * task would cancel all its future runs.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
