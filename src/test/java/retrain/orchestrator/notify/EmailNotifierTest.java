package retrain.orchestrator.notify;

import jakarta.mail.Message;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.Test;
import retrain.orchestrator.model.JobStatus;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EmailNotifierTest {

    private static NotificationEvent event(String error) {
        return new NotificationEvent("train-abc", "bert <large>", JobStatus.FAILED, 3, 3,
                "Job failed after 3 retries: " + error, error,
                Instant.parse("2024-01-01T01:00:00Z"), null, Instant.parse("2024-01-01T02:00:00Z"));
    }

    @Test
    void subjectNamesStatusAndJob() {
        assertEquals("Training Job FAILED: bert <large>", EmailNotifier.subject(event("OOM")));
    }

    @Test
    void bodyEscapesUserText() {
        String body = EmailNotifier.body(event("x < y & z"));

        assertTrue(body.contains("<td>bert &lt;large&gt;</td>"), body);
        assertTrue(body.contains("<strong>failed</strong>"), body);
        assertTrue(body.contains("<td>3/3</td>"), body);
        assertTrue(body.contains("<td>2024-01-01T01:00:00Z</td>"), body);
        assertTrue(body.contains("<td>N/A</td>"), body);
        assertTrue(body.contains("<strong>Error:</strong> x &lt; y &amp; z"), body);
    }

    @Test
    void bodyOmitsErrorWhenAbsent() {
        NotificationEvent success = new NotificationEvent("train-abc", "bert", JobStatus.COMPLETED, 0, 3,
                "Training job completed successfully in 0:10:00", null, null, null, Instant.EPOCH);

        assertFalse(EmailNotifier.body(success).contains("Error:"));
    }

    @Test
    void messageAddressesAllRecipients() throws Exception {
        EmailNotifier notifier = new EmailNotifier("smtp.example.com", 587, "bot@example.com", "",
                List.of("a@example.com", "b@example.com"));

        MimeMessage message = notifier.buildMessage(event("OOM"));

        assertEquals(2, message.getRecipients(Message.RecipientType.TO).length);
        assertEquals("bot@example.com", message.getFrom()[0].toString());
        assertEquals("Training Job FAILED: bert <large>", message.getSubject());
        assertEquals("email", notifier.channel());
    }
}
