package retrain.orchestrator.config;

import org.junit.jupiter.api.Test;
import retrain.orchestrator.scheduler.RetryMode;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorConfigTest {

    @Test
    void defaultsNeedNoEnvironment() {
        OrchestratorConfig config = OrchestratorConfig.fromMap(Map.of());

        assertEquals(3, config.defaultMaxRetries());
        assertEquals(RetryMode.ON_SCHEDULE, config.retryMode());
        assertEquals(OrchestratorConfig.BackendType.SIMULATED, config.backendType());
        assertEquals(Duration.ofSeconds(30), config.backendTimeout());
        assertFalse(config.hasSlack());
        assertFalse(config.hasEmail());
        assertTrue(config.recipientEmails().isEmpty());
    }

    @Test
    void readsEnvironmentKeys() {
        OrchestratorConfig config = OrchestratorConfig.fromMap(Map.ofEntries(
                Map.entry("RETRAIN_DB_URL", "jdbc:h2:mem:env"),
                Map.entry("RETRAIN_PORT", " 9090 "),
                Map.entry("RETRAIN_TICK_SECONDS", "15"),
                Map.entry("RETRAIN_CRON_ZONE", "Europe/Berlin"),
                Map.entry("RETRAIN_DEFAULT_MAX_RETRIES", "5"),
                Map.entry("RETRAIN_RETRY_MODE", "backoff"),
                Map.entry("RETRAIN_RETRY_BACKOFF_BASE_SECONDS", "10"),
                Map.entry("RETRAIN_RETRY_BACKOFF_MAX_SECONDS", "600"),
                Map.entry("RETRAIN_BACKEND", "docker"),
                Map.entry("RETRAIN_SIM_FAIL_RATE", "0.5"),
                Map.entry("SLACK_WEBHOOK_URL", "https://hooks.slack.com/services/x"),
                Map.entry("SENDER_EMAIL", "bot@example.com"),
                Map.entry("RECIPIENT_EMAILS", "a@example.com, b@example.com,,")));

        assertEquals("jdbc:h2:mem:env", config.databaseUrl());
        assertEquals(9090, config.serverPort());
        assertEquals(Duration.ofSeconds(15), config.tickInterval());
        assertEquals(ZoneId.of("Europe/Berlin"), config.cronZone());
        assertEquals(5, config.defaultMaxRetries());
        assertEquals(RetryMode.BACKOFF, config.retryMode());
        assertEquals(Duration.ofSeconds(10), config.retryBackoffBase());
        assertEquals(Duration.ofMinutes(10), config.retryBackoffMax());
        assertEquals(OrchestratorConfig.BackendType.DOCKER, config.backendType());
        assertEquals(0.5, config.simulatedFailRate());
        assertTrue(config.hasSlack());
        assertEquals(List.of("a@example.com", "b@example.com"), config.recipientEmails());
        assertTrue(config.hasEmail());
    }

    @Test
    void blankValuesKeepDefaults() {
        OrchestratorConfig config = OrchestratorConfig.fromMap(Map.of("RETRAIN_PORT", "  ", "SLACK_WEBHOOK_URL", ""));

        assertEquals(OrchestratorConfig.defaults().serverPort(), config.serverPort());
        assertFalse(config.hasSlack());
    }

    @Test
    void fluentSettersChain() {
        OrchestratorConfig config = OrchestratorConfig.defaults()
                .withDefaultMaxRetries(7)
                .withRetryMode(RetryMode.BACKOFF)
                .withRetryBackoff(Duration.ofSeconds(5), Duration.ofMinutes(1));

        assertEquals(7, config.defaultMaxRetries());
        assertEquals(RetryMode.BACKOFF, config.retryMode());
        assertEquals(Duration.ofMinutes(1), config.retryBackoffMax());
    }
}
