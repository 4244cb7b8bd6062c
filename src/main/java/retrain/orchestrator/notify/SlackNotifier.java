package retrain.orchestrator.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import retrain.orchestrator.error.NotificationException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Posts a colored attachment to a Slack incoming webhook.
 */
public class SlackNotifier implements Notifier {

    static final String CHANNEL = "slack";
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final URI webhook;

    public SlackNotifier(String webhookUrl) {
        this(webhookUrl, HttpClient.newBuilder().connectTimeout(TIMEOUT).build());
    }

    SlackNotifier(String webhookUrl, HttpClient httpClient) {
        this.webhook = URI.create(webhookUrl);
        this.httpClient = httpClient;
    }

    @Override
    public String channel() {
        return CHANNEL;
    }

    @Override
    public void send(NotificationEvent event) {
        HttpRequest request = HttpRequest.newBuilder(webhook)
                .timeout(TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload(event)))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new NotificationException(CHANNEL, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationException(CHANNEL, "interrupted", e);
        }

        if (response.statusCode() >= 300) {
            throw new NotificationException(CHANNEL, "webhook returned HTTP " + response.statusCode());
        }
    }

    String payload(NotificationEvent event) {
        ObjectNode attachment = mapper.createObjectNode();
        attachment.put("color", color(event));
        attachment.put("title", "Training Job: " + event.jobName());

        ArrayNode fields = attachment.putArray("fields");
        addField(fields, "Job ID", event.jobId(), true);
        addField(fields, "Status", event.status().value(), true);
        addField(fields, "Retry Count", String.valueOf(event.retryCount()), true);
        addField(fields, "Message", event.message(), false);
        attachment.put("ts", event.occurredAt().getEpochSecond());

        ObjectNode root = mapper.createObjectNode();
        root.putArray("attachments").add(attachment);
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new NotificationException(CHANNEL, "cannot serialize payload", e);
        }
    }

    static String color(NotificationEvent event) {
        return switch (event.status()) {
            case COMPLETED -> "good";
            case FAILED -> "danger";
            case RETRYING -> "warning";
            default -> "#808080";
        };
    }

    private void addField(ArrayNode fields, String title, String value, boolean isShort) {
        ObjectNode field = fields.addObject();
        field.put("title", title);
        field.put("value", value);
        field.put("short", isShort);
    }
}
