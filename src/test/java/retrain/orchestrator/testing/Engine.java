package retrain.orchestrator.testing;

import retrain.orchestrator.config.OrchestratorConfig;
import retrain.orchestrator.cron.CronUtilsEvaluator;
import retrain.orchestrator.metrics.OrchestratorMetrics;
import retrain.orchestrator.model.Execution;
import retrain.orchestrator.model.Job;
import retrain.orchestrator.notify.NotificationDispatcher;
import retrain.orchestrator.scheduler.JobLocks;
import retrain.orchestrator.scheduler.JobTicker;
import retrain.orchestrator.scheduler.RetryPolicy;
import retrain.orchestrator.service.JobService;
import retrain.orchestrator.service.StatsService;
import retrain.orchestrator.store.Database;
import retrain.orchestrator.store.JdbcExecutionRepository;
import retrain.orchestrator.store.JdbcJobRepository;
import retrain.orchestrator.store.JdbcMetricRepository;
import retrain.orchestrator.store.JdbcNotificationRepository;

import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * The engine wired over an in-memory database, a scripted backend, two
 * recording channels and a mutable clock starting at 2024-01-01T00:00:00Z.
 * Notifications are delivered synchronously on the calling thread.
 * Meters go to a private Prometheus registry.
 */
public final class Engine implements AutoCloseable {

    public final MutableClock clock = MutableClock.at("2024-01-01T00:00:00Z");
    public final Database db;
    public final JdbcJobRepository jobs;
    public final JdbcExecutionRepository executions;
    public final JdbcNotificationRepository notifications;
    public final JdbcMetricRepository metrics;
    public final OrchestratorMetrics meters;
    public final ScriptedBackend backend = new ScriptedBackend();
    public final RecordingNotifier slack;
    public final RecordingNotifier email;
    public final JobLocks locks = new JobLocks();
    public final JobTicker ticker;
    public final JobService service;
    public final StatsService stats;

    private final ExecutorService backendExecutor = Executors.newCachedThreadPool();

    public Engine(String name) {
        this(name, RetryPolicy.onSchedule(), Duration.ofSeconds(5), new RecordingNotifier("slack"),
                new RecordingNotifier("email"));
    }

    public Engine(String name, RetryPolicy retryPolicy, Duration backendTimeout, RecordingNotifier slack,
            RecordingNotifier email) {
        this(name, retryPolicy, backendTimeout, slack, email, JdbcJobRepository::new);
    }

    /** Engine over a job repository of the test's choosing */
    public Engine(String name, Function<Database, JdbcJobRepository> jobRepository) {
        this(name, RetryPolicy.onSchedule(), Duration.ofSeconds(5), new RecordingNotifier("slack"),
                new RecordingNotifier("email"), jobRepository);
    }

    private Engine(String name, RetryPolicy retryPolicy, Duration backendTimeout, RecordingNotifier slack,
            RecordingNotifier email, Function<Database, JdbcJobRepository> jobRepository) {
        this.db = TestDatabases.create(name);
        this.jobs = jobRepository.apply(db);
        this.executions = new JdbcExecutionRepository(db);
        this.notifications = new JdbcNotificationRepository(db);
        this.metrics = new JdbcMetricRepository(db);
        this.meters = OrchestratorMetrics.prometheus(jobs);
        this.slack = slack;
        this.email = email;

        CronUtilsEvaluator cron = new CronUtilsEvaluator(ZoneOffset.UTC);
        NotificationDispatcher dispatcher = new NotificationDispatcher(List.of(slack, email), notifications,
                meters, Runnable::run, clock);
        this.ticker = new JobTicker(jobs, executions, metrics, db, meters, backend, cron, retryPolicy, dispatcher,
                locks, backendExecutor, backendTimeout, clock);
        this.service = new JobService(jobs, executions, metrics, cron, locks, meters, OrchestratorConfig.defaults(),
                clock);
        this.stats = new StatsService(jobs);
    }

    /** Hourly job with a checkpoint, registered at the current clock time */
    public Job hourlyJob(String name, int maxRetries) {
        return service.register(name, "trainer:latest", List.of("python", "train.py"), "0 * * * *", maxRetries,
                "/ckpt/a");
    }

    public Job reload(Job job) {
        return jobs.findById(job.id()).orElseThrow();
    }

    public List<Execution> executionsOf(Job job) {
        return executions.findByJobId(job.id());
    }

    /** Move the clock and run one tick */
    public JobTicker.TickResult tickAt(String isoInstant) {
        clock.set(java.time.Instant.parse(isoInstant));
        return ticker.tick();
    }

    @Override
    public void close() {
        backendExecutor.shutdownNow();
        db.close();
    }
}
