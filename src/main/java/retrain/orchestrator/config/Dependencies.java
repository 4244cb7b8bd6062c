package retrain.orchestrator.config;

import retrain.orchestrator.api.v1.HealthController;
import retrain.orchestrator.api.v1.JobController;
import retrain.orchestrator.api.v1.MetricsController;
import retrain.orchestrator.api.v1.StatsController;
import retrain.orchestrator.backend.DockerExecutionBackend;
import retrain.orchestrator.backend.ExecutionBackend;
import retrain.orchestrator.cron.CronEvaluator;
import retrain.orchestrator.cron.CronUtilsEvaluator;
import retrain.orchestrator.metrics.OrchestratorMetrics;
import retrain.orchestrator.notify.EmailNotifier;
import retrain.orchestrator.notify.NotificationDispatcher;
import retrain.orchestrator.notify.Notifier;
import retrain.orchestrator.notify.SlackNotifier;
import retrain.orchestrator.repository.ExecutionRepository;
import retrain.orchestrator.repository.JobRepository;
import retrain.orchestrator.repository.MetricRepository;
import retrain.orchestrator.repository.NotificationRepository;
import retrain.orchestrator.scheduler.JobLocks;
import retrain.orchestrator.scheduler.JobTicker;
import retrain.orchestrator.scheduler.RetryPolicy;
import retrain.orchestrator.scheduler.Scheduler;
import retrain.orchestrator.server.RouterHandler;
import retrain.orchestrator.service.JobService;
import retrain.orchestrator.service.StatsService;
import retrain.orchestrator.simulation.SimulatedExecutionBackend;
import retrain.orchestrator.store.Database;
import retrain.orchestrator.store.JdbcExecutionRepository;
import retrain.orchestrator.store.JdbcJobRepository;
import retrain.orchestrator.store.JdbcMetricRepository;
import retrain.orchestrator.store.JdbcNotificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(OrchestratorConfig.fromEnv());
 * deps.startScheduler(); // start ticking
 * JobService jobService = deps.jobService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final OrchestratorConfig config;
    private final Clock clock;
    private final Database database;
    private final JobRepository jobRepository;
    private final ExecutionRepository executionRepository;
    private final NotificationRepository notificationRepository;
    private final MetricRepository metricRepository;
    private final OrchestratorMetrics metrics;
    private final CronEvaluator cron;
    private final JobLocks locks;
    private final ExecutionBackend backend;
    private final ExecutorService backendExecutor;
    private final ExecutorService notificationExecutor;
    private final NotificationDispatcher notificationDispatcher;
    private final JobTicker ticker;
    private final Scheduler scheduler;
    private final JobService jobService;
    private final StatsService statsService;

    // Controllers
    private final HealthController healthController;
    private final JobController jobController;
    private final StatsController statsController;
    private final MetricsController metricsController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(OrchestratorConfig config, Clock clock, ExecutionBackend backend, List<Notifier> notifiers) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.backend = backend != null ? backend : createBackend(config, clock);
        this.backendExecutor = Executors.newCachedThreadPool(daemonThreads("retrain-backend"));
        this.notificationExecutor = Executors.newFixedThreadPool(config.notificationThreads(),
                daemonThreads("retrain-notify"));

        // Repositories
        this.jobRepository = new JdbcJobRepository(database);
        this.executionRepository = new JdbcExecutionRepository(database);
        this.notificationRepository = new JdbcNotificationRepository(database);
        this.metricRepository = new JdbcMetricRepository(database);
        this.metrics = OrchestratorMetrics.prometheus(jobRepository);

        // Engine
        this.cron = new CronUtilsEvaluator(config.cronZone());
        this.locks = new JobLocks();
        RetryPolicy retryPolicy = new RetryPolicy(config.retryMode(), config.retryBackoffBase(),
                config.retryBackoffMax());
        this.notificationDispatcher = new NotificationDispatcher(
                notifiers != null ? notifiers : createNotifiers(config),
                notificationRepository, metrics, notificationExecutor, clock);
        this.ticker = new JobTicker(jobRepository, executionRepository, metricRepository, database, metrics,
                this.backend, cron, retryPolicy, notificationDispatcher, locks, backendExecutor,
                config.backendTimeout(), clock);
        this.scheduler = new Scheduler(ticker, config.tickInterval());

        // Services
        this.jobService = new JobService(jobRepository, executionRepository, metricRepository, cron, locks, metrics,
                config, clock);
        this.statsService = new StatsService(jobRepository);

        // Controllers (public API)
        this.healthController = new HealthController(database, this.backend.name(), scheduler::isRunning, clock);
        this.jobController = new JobController(jobService);
        this.statsController = new StatsController(statsService);
        this.metricsController = new MetricsController(metrics);

        log.info("Dependencies initialized: backend={}, notifications={}", this.backend.name(),
                notificationDispatcher.channels());
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(OrchestratorConfig config) {
        return new Dependencies(config, Clock.systemUTC(), null, null);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(OrchestratorConfig.fromEnv());
    }

    /**
     * Create dependencies around a given clock, backend and channels instead
     * of the configured ones.
     */
    public static Dependencies create(OrchestratorConfig config, Clock clock, ExecutionBackend backend,
            List<Notifier> notifiers) {
        return new Dependencies(config, clock, backend, notifiers);
    }

    private static ExecutionBackend createBackend(OrchestratorConfig config, Clock clock) {
        return switch (config.backendType()) {
            case DOCKER -> new DockerExecutionBackend(config);
            case SIMULATED -> new SimulatedExecutionBackend(clock, Duration.ofSeconds(30), Duration.ofMinutes(3),
                    config.simulatedFailRate());
        };
    }

    private static List<Notifier> createNotifiers(OrchestratorConfig config) {
        List<Notifier> notifiers = new ArrayList<>();
        if (config.hasSlack()) {
            notifiers.add(new SlackNotifier(config.slackWebhookUrl()));
        } else {
            log.warn("Slack webhook not configured");
        }
        if (config.hasEmail()) {
            notifiers.add(new EmailNotifier(config));
        } else {
            log.warn("Email not configured");
        }
        return notifiers;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // Getters
    public OrchestratorConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public ExecutionRepository executionRepository() {
        return executionRepository;
    }

    public NotificationRepository notificationRepository() {
        return notificationRepository;
    }

    public MetricRepository metricRepository() {
        return metricRepository;
    }

    public OrchestratorMetrics metrics() {
        return metrics;
    }

    public ExecutionBackend backend() {
        return backend;
    }

    public JobTicker ticker() {
        return ticker;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    public JobService jobService() {
        return jobService;
    }

    public StatsService statsService() {
        return statsService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(statsController)
                    .registerController(metricsController)
                    .registerController(jobController);
            log.info("RouterHandler created with {} controllers", 4);
        }
        return routerHandler;
    }

    /**
     * Start the background scheduler.
     * Should be called after server startup.
     */
    public void startScheduler() {
        scheduler.start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop ticking first so nothing new is submitted
        try {
            scheduler.stop();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        backendExecutor.shutdownNow();

        // Let queued notifications drain briefly
        notificationExecutor.shutdown();
        try {
            if (!notificationExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                notificationExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            notificationExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        try {
            backend.close();
        } catch (Exception e) {
            log.warn("Error closing backend: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
