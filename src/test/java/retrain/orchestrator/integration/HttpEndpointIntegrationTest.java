package retrain.orchestrator.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import retrain.orchestrator.backend.PollResult;
import retrain.orchestrator.config.Dependencies;
import retrain.orchestrator.config.OrchestratorConfig;
import retrain.orchestrator.server.OrchestratorNettyServer;
import retrain.orchestrator.testing.MutableClock;
import retrain.orchestrator.testing.ScriptedBackend;
import retrain.orchestrator.testing.TestDatabases;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Hits the real HTTP endpoints through Netty. Ticks are driven by the test
 * instead of the background scheduler.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String CREATE_BODY = """
            {
                "name": "resnet-nightly",
                "image": "registry.local/trainer:1.4",
                "command": ["python", "train.py", "--epochs", "10"],
                "schedule": "0 * * * *",
                "max_retries": 1,
                "checkpoint_path": "/ckpt/resnet"
            }
            """;

    private final MutableClock clock = MutableClock.at("2024-01-01T00:00:00Z");
    private final ScriptedBackend backend = new ScriptedBackend();

    private Dependencies deps;
    private OrchestratorNettyServer server;
    private HttpClient httpClient;
    private String baseUrl;

    @BeforeEach
    void setUp() {
        OrchestratorConfig config = OrchestratorConfig.defaults()
                .withDatabaseUrl(TestDatabases.url("http"))
                .withBackendTimeout(Duration.ofSeconds(5));
        deps = Dependencies.create(config, clock, backend, List.of());

        server = new OrchestratorNettyServer(deps.routerHandler());
        server.start("127.0.0.1", 0);
        baseUrl = "http://127.0.0.1:" + server.port();

        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        deps.close();
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body);
        return httpClient.send(
                HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + path))
                        .header("Content-Type", "application/json")
                        .method(method, publisher)
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode json(HttpResponse<String> response) throws Exception {
        return MAPPER.readTree(response.body());
    }

    private String createJob() throws Exception {
        HttpResponse<String> response = send("POST", "/api/v1/jobs", CREATE_BODY);
        assertEquals(201, response.statusCode(), response.body());
        return json(response).get("job_id").asText();
    }

    private void tickAt(String isoInstant) {
        clock.set(Instant.parse(isoInstant));
        deps.ticker().tick();
    }

    @Test
    @DisplayName("Create then read a job")
    void createAndGet() throws Exception {
        String jobId = createJob();

        HttpResponse<String> response = send("GET", "/api/v1/jobs/" + jobId, null);
        assertEquals(200, response.statusCode());

        JsonNode job = json(response);
        assertEquals("resnet-nightly", job.get("name").asText());
        assertEquals("pending", job.get("status").asText());
        assertEquals(1, job.get("max_retries").asInt());
        assertEquals(0, job.get("retry_count").asInt());
        assertEquals(4, job.get("command").size());
        assertEquals("/ckpt/resnet", job.get("checkpoint_path").asText());
        assertEquals("2024-01-01T00:00:00Z", job.get("created_at").asText());
    }

    @Test
    @DisplayName("Duplicate name is a conflict")
    void duplicateName() throws Exception {
        createJob();

        HttpResponse<String> response = send("POST", "/api/v1/jobs", CREATE_BODY);

        assertEquals(409, response.statusCode());
        assertNotNull(json(response).get("error"));
        assertNotNull(json(response).get("code"));
    }

    @Test
    @DisplayName("Invalid input is rejected with 400")
    void invalidInput() throws Exception {
        String badSchedule = CREATE_BODY.replace("0 * * * *", "whenever");
        assertEquals(400, send("POST", "/api/v1/jobs", badSchedule).statusCode());

        String noImage = """
                {"name": "x", "command": ["run"], "schedule": "0 * * * *"}
                """;
        assertEquals(400, send("POST", "/api/v1/jobs", noImage).statusCode());

        assertEquals(400, send("POST", "/api/v1/jobs", "{not json").statusCode());
        assertEquals(400, send("GET", "/api/v1/jobs?status=paused", null).statusCode());
        assertEquals(400, send("GET", "/api/v1/jobs?page_size=500", null).statusCode());
    }

    @Test
    @DisplayName("Unknown job is 404")
    void unknownJob() throws Exception {
        assertEquals(404, send("GET", "/api/v1/jobs/train-nope", null).statusCode());
        assertEquals(404, send("DELETE", "/api/v1/jobs/train-nope", null).statusCode());
        assertEquals(404, send("POST", "/api/v1/jobs/train-nope/retry", null).statusCode());
        assertEquals(404, send("GET", "/api/v1/nothing-here", null).statusCode());
    }

    @Test
    @DisplayName("List supports status filter and paging")
    void listJobs() throws Exception {
        createJob();
        send("POST", "/api/v1/jobs", CREATE_BODY.replace("resnet-nightly", "bert-weekly"));

        JsonNode all = json(send("GET", "/api/v1/jobs?page=1&page_size=1", null));
        assertEquals(2, all.get("total").asInt());
        assertEquals(1, all.get("jobs").size());
        assertEquals(1, all.get("page_size").asInt());

        JsonNode failed = json(send("GET", "/api/v1/jobs?status=failed", null));
        assertEquals(0, failed.get("total").asInt());
    }

    @Test
    @DisplayName("Update changes fields; running job cannot be updated")
    void updateJob() throws Exception {
        String jobId = createJob();

        HttpResponse<String> updated = send("PUT", "/api/v1/jobs/" + jobId,
                "{\"schedule\": \"30 2 * * *\", \"max_retries\": 4}");
        assertEquals(200, updated.statusCode(), updated.body());
        assertEquals("30 2 * * *", json(updated).get("schedule").asText());
        assertEquals(4, json(updated).get("max_retries").asInt());

        tickAt("2024-01-01T02:30:00Z");
        assertEquals(409, send("PUT", "/api/v1/jobs/" + jobId, "{\"image\": \"x:2\"}").statusCode());
        assertEquals(409, send("DELETE", "/api/v1/jobs/" + jobId, null).statusCode());
    }

    @Test
    @DisplayName("Failed job: executions, manual retry, stats")
    void failureRetryAndStats() throws Exception {
        String jobId = createJob();
        backend.setDefaultOutcome(PollResult.failed("exit code 137"));

        assertEquals(409, send("POST", "/api/v1/jobs/" + jobId + "/retry", null).statusCode());

        tickAt("2024-01-01T01:00:00Z");
        tickAt("2024-01-01T01:10:00Z");
        tickAt("2024-01-01T02:00:00Z");
        tickAt("2024-01-01T02:10:00Z");

        JsonNode job = json(send("GET", "/api/v1/jobs/" + jobId, null));
        assertEquals("failed", job.get("status").asText());
        assertEquals("exit code 137", job.get("error_message").asText());

        JsonNode history = json(send("GET", "/api/v1/jobs/" + jobId + "/executions", null));
        assertEquals(jobId, history.get("job_id").asText());
        JsonNode executions = history.get("executions");
        assertEquals(2, executions.size());
        assertEquals(1, executions.get(0).get("execution_number").asInt());
        assertEquals("failed", executions.get(1).get("status").asText());
        assertEquals(600, executions.get(1).get("duration_seconds").asLong());
        assertEquals("/ckpt/resnet", executions.get(1).get("checkpoint_used").asText());

        JsonNode stats = json(send("GET", "/api/v1/stats", null));
        assertEquals(1, stats.get("total_jobs").asInt());
        assertEquals(1, stats.get("failed").asInt());
        assertEquals(0, stats.get("pending").asInt());

        HttpResponse<String> retried = send("POST", "/api/v1/jobs/" + jobId + "/retry", null);
        assertEquals(200, retried.statusCode());
        assertEquals("pending", json(retried).get("status").asText());
        assertEquals(0, json(retried).get("retry_count").asInt());
    }

    @Test
    @DisplayName("Per-job samples and the Prometheus scrape")
    void metrics() throws Exception {
        String jobId = createJob();
        tickAt("2024-01-01T01:00:00Z");
        backend.finishLast(PollResult.succeeded());
        tickAt("2024-01-01T01:15:00Z");

        JsonNode samples = json(send("GET", "/api/v1/jobs/" + jobId + "/metrics", null));
        assertEquals(jobId, samples.get("job_id").asText());
        assertEquals(2, samples.get("metrics").size());
        assertEquals("2024-01-01T01:15:00Z", samples.get("metrics").get(0).get("recorded_at").asText());
        assertEquals(404, send("GET", "/api/v1/jobs/train-missing/metrics", null).statusCode());

        HttpResponse<String> scrape = send("GET", "/api/v1/metrics", null);
        assertEquals(200, scrape.statusCode());
        assertTrue(scrape.headers().firstValue("Content-Type").orElseThrow().startsWith("text/plain"));
        assertTrue(scrape.body().contains("training_jobs_created_total"), scrape.body());
        assertTrue(scrape.body().contains("training_jobs_duration_seconds_count"), scrape.body());
        assertTrue(scrape.body().contains("training_executions_total"), scrape.body());
    }

    @Test
    @DisplayName("Delete returns 204 and removes the job")
    void deleteJob() throws Exception {
        String jobId = createJob();

        assertEquals(204, send("DELETE", "/api/v1/jobs/" + jobId, null).statusCode());
        assertEquals(404, send("GET", "/api/v1/jobs/" + jobId, null).statusCode());
    }

    @Test
    @DisplayName("Health reports database and backend")
    void health() throws Exception {
        HttpResponse<String> response = send("GET", "/api/v1/health", null);

        assertEquals(200, response.statusCode());
        JsonNode health = json(response);
        assertEquals("healthy", health.get("status").asText());
        assertTrue(health.get("database_connected").asBoolean());
        assertEquals("scripted", health.get("backend").asText());
        assertFalse(health.get("scheduler_running").asBoolean());
    }
}
