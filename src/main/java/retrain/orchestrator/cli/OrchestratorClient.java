package retrain.orchestrator.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import retrain.orchestrator.error.ApiClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Thin client for the orchestrator's /api/v1 endpoints. Responses are
 * returned as JSON trees; error statuses become {@link ApiClientException}.
 */
public class OrchestratorClient {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorClient.class);

    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    static final int LIST_PAGE_SIZE = 100;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final String baseUrl;

    public OrchestratorClient(String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = HttpClient.newBuilder().connectTimeout(TIMEOUT).build();
    }

    public String baseUrl() {
        return baseUrl;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * @param status optional status filter, null for all
     */
    public JsonNode listJobs(String status) {
        String query = "?page_size=" + LIST_PAGE_SIZE;
        if (status != null) {
            query += "&status=" + encode(status);
        }
        return request("GET", "/api/v1/jobs" + query, null);
    }

    public JsonNode getJob(String jobId) {
        return request("GET", "/api/v1/jobs/" + encode(jobId), null);
    }

    public JsonNode createJob(ObjectNode job) {
        return request("POST", "/api/v1/jobs", job.toString());
    }

    public void deleteJob(String jobId) {
        request("DELETE", "/api/v1/jobs/" + encode(jobId), null);
    }

    public JsonNode retryJob(String jobId) {
        return request("POST", "/api/v1/jobs/" + encode(jobId) + "/retry", null);
    }

    public JsonNode stats() {
        return request("GET", "/api/v1/stats", null);
    }

    public JsonNode health() {
        return request("GET", "/api/v1/health", null);
    }

    private JsonNode request(String method, String path, String body) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(TIMEOUT)
                .header("Content-Type", "application/json")
                .method(method, body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ApiClientException("Cannot reach " + baseUrl + ": " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiClientException("Interrupted calling " + baseUrl, e);
        }
        log.debug("{} {} -> {}", method, path, response.statusCode());

        JsonNode json = parse(response.body());
        if (response.statusCode() >= 300) {
            String code = json.path("code").isTextual() ? json.get("code").asText() : null;
            String message = json.path("error").isTextual()
                    ? json.get("error").asText()
                    : "HTTP " + response.statusCode();
            throw new ApiClientException(response.statusCode(), code, message);
        }
        return json;
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(body);
        } catch (IOException e) {
            throw new ApiClientException("Unreadable response from " + baseUrl + ": " + e.getMessage(), e);
        }
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
