package retrain.orchestrator.config;

import retrain.orchestrator.scheduler.RetryMode;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Configuration holder for orchestrator settings.
 * All settings have sensible defaults; {@link #fromEnv()} overrides them
 * from environment variables.
 */
public final class OrchestratorConfig {

    /** Backend implementations selectable with RETRAIN_BACKEND */
    public enum BackendType {
        DOCKER,
        SIMULATED
    }

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/retrain;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Scheduler settings
    private Duration tickInterval = Duration.ofMinutes(1);
    private ZoneId cronZone = ZoneId.of("UTC");

    // Retry settings
    private int defaultMaxRetries = 3;
    private RetryMode retryMode = RetryMode.ON_SCHEDULE;
    private Duration retryBackoffBase = Duration.ofSeconds(60);
    private Duration retryBackoffMax = Duration.ofHours(1);

    // Backend settings
    private BackendType backendType = BackendType.SIMULATED;
    private Duration backendTimeout = Duration.ofSeconds(30);
    private String dockerHost = "unix:///var/run/docker.sock";
    private String checkpointMount = "/checkpoints";
    private double simulatedFailRate = 0.2;

    // Notification settings
    private String slackWebhookUrl = null;
    private String smtpServer = "smtp.gmail.com";
    private int smtpPort = 587;
    private String senderEmail = null;
    private String senderPassword = null;
    private List<String> recipientEmails = List.of();
    private int notificationThreads = 2;

    private OrchestratorConfig() {
    }

    public static OrchestratorConfig defaults() {
        return new OrchestratorConfig();
    }

    public static OrchestratorConfig fromEnv() {
        return fromMap(System.getenv());
    }

    /**
     * Build a config from an environment-like map. Unknown keys are ignored.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static OrchestratorConfig fromMap(Map<String, String> env) {
        OrchestratorConfig config = new OrchestratorConfig();

        String dbUrl = env.get("RETRAIN_DB_URL");
        if (isSet(dbUrl)) {
            config.databaseUrl = dbUrl;
        }

        String port = env.get("RETRAIN_PORT");
        if (isSet(port)) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        String tick = env.get("RETRAIN_TICK_SECONDS");
        if (isSet(tick)) {
            config.tickInterval = Duration.ofSeconds(Long.parseLong(tick.trim()));
        }

        String zone = env.get("RETRAIN_CRON_ZONE");
        if (isSet(zone)) {
            config.cronZone = ZoneId.of(zone.trim());
        }

        String maxRetries = env.get("RETRAIN_DEFAULT_MAX_RETRIES");
        if (isSet(maxRetries)) {
            config.defaultMaxRetries = Integer.parseInt(maxRetries.trim());
        }

        String retryMode = env.get("RETRAIN_RETRY_MODE");
        if (isSet(retryMode)) {
            config.retryMode = RetryMode.valueOf(retryMode.trim().toUpperCase());
        }

        String backoffBase = env.get("RETRAIN_RETRY_BACKOFF_BASE_SECONDS");
        if (isSet(backoffBase)) {
            config.retryBackoffBase = Duration.ofSeconds(Long.parseLong(backoffBase.trim()));
        }

        String backoffMax = env.get("RETRAIN_RETRY_BACKOFF_MAX_SECONDS");
        if (isSet(backoffMax)) {
            config.retryBackoffMax = Duration.ofSeconds(Long.parseLong(backoffMax.trim()));
        }

        String backend = env.get("RETRAIN_BACKEND");
        if (isSet(backend)) {
            config.backendType = BackendType.valueOf(backend.trim().toUpperCase());
        }

        String backendTimeout = env.get("RETRAIN_BACKEND_TIMEOUT_SECONDS");
        if (isSet(backendTimeout)) {
            config.backendTimeout = Duration.ofSeconds(Long.parseLong(backendTimeout.trim()));
        }

        String dockerHost = env.get("DOCKER_HOST");
        if (isSet(dockerHost)) {
            config.dockerHost = dockerHost;
        }

        String mount = env.get("RETRAIN_CHECKPOINT_MOUNT");
        if (isSet(mount)) {
            config.checkpointMount = mount;
        }

        String failRate = env.get("RETRAIN_SIM_FAIL_RATE");
        if (isSet(failRate)) {
            config.simulatedFailRate = Double.parseDouble(failRate.trim());
        }

        String slack = env.get("SLACK_WEBHOOK_URL");
        if (isSet(slack)) {
            config.slackWebhookUrl = slack;
        }

        String smtpServer = env.get("SMTP_SERVER");
        if (isSet(smtpServer)) {
            config.smtpServer = smtpServer;
        }

        String smtpPort = env.get("SMTP_PORT");
        if (isSet(smtpPort)) {
            config.smtpPort = Integer.parseInt(smtpPort.trim());
        }

        String sender = env.get("SENDER_EMAIL");
        if (isSet(sender)) {
            config.senderEmail = sender;
        }

        String password = env.get("SENDER_PASSWORD");
        if (isSet(password)) {
            config.senderPassword = password;
        }

        String recipients = env.get("RECIPIENT_EMAILS");
        if (isSet(recipients)) {
            config.recipientEmails = Arrays.stream(recipients.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
        }

        return config;
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Duration tickInterval() {
        return tickInterval;
    }

    public ZoneId cronZone() {
        return cronZone;
    }

    public int defaultMaxRetries() {
        return defaultMaxRetries;
    }

    public RetryMode retryMode() {
        return retryMode;
    }

    public Duration retryBackoffBase() {
        return retryBackoffBase;
    }

    public Duration retryBackoffMax() {
        return retryBackoffMax;
    }

    public BackendType backendType() {
        return backendType;
    }

    public Duration backendTimeout() {
        return backendTimeout;
    }

    public String dockerHost() {
        return dockerHost;
    }

    public String checkpointMount() {
        return checkpointMount;
    }

    public double simulatedFailRate() {
        return simulatedFailRate;
    }

    public String slackWebhookUrl() {
        return slackWebhookUrl;
    }

    public boolean hasSlack() {
        return isSet(slackWebhookUrl);
    }

    public String smtpServer() {
        return smtpServer;
    }

    public int smtpPort() {
        return smtpPort;
    }

    public String senderEmail() {
        return senderEmail;
    }

    public String senderPassword() {
        return senderPassword;
    }

    public List<String> recipientEmails() {
        return recipientEmails;
    }

    public boolean hasEmail() {
        return isSet(senderEmail) && !recipientEmails.isEmpty();
    }

    public int notificationThreads() {
        return notificationThreads;
    }

    // Fluent setters for testing/customization
    public OrchestratorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public OrchestratorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public OrchestratorConfig withTickInterval(Duration interval) {
        this.tickInterval = interval;
        return this;
    }

    public OrchestratorConfig withDefaultMaxRetries(int maxRetries) {
        this.defaultMaxRetries = maxRetries;
        return this;
    }

    public OrchestratorConfig withRetryMode(RetryMode mode) {
        this.retryMode = mode;
        return this;
    }

    public OrchestratorConfig withRetryBackoff(Duration base, Duration max) {
        this.retryBackoffBase = base;
        this.retryBackoffMax = max;
        return this;
    }

    public OrchestratorConfig withBackendType(BackendType type) {
        this.backendType = type;
        return this;
    }

    public OrchestratorConfig withBackendTimeout(Duration timeout) {
        this.backendTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withSlackWebhookUrl(String url) {
        this.slackWebhookUrl = url;
        return this;
    }

    @Override
    public String toString() {
        return "OrchestratorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", tick=" + tickInterval +
                ", backend=" + backendType +
                ", retryMode=" + retryMode +
                ", defaultMaxRetries=" + defaultMaxRetries +
                ", slack=" + hasSlack() +
                ", email=" + hasEmail() +
                '}';
    }
}
