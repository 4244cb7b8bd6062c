package retrain.orchestrator.notify;

import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import retrain.orchestrator.config.OrchestratorConfig;
import retrain.orchestrator.error.NotificationException;

import java.time.Instant;
import java.util.List;
import java.util.Properties;

/**
 * Sends an HTML status mail over SMTP with STARTTLS.
 */
public class EmailNotifier implements Notifier {

    static final String CHANNEL = "email";

    private final Session session;
    private final String sender;
    private final List<String> recipients;

    public EmailNotifier(OrchestratorConfig config) {
        this(config.smtpServer(), config.smtpPort(), config.senderEmail(), config.senderPassword(),
                config.recipientEmails());
    }

    public EmailNotifier(String smtpServer, int smtpPort, String sender, String password,
            List<String> recipients) {
        Properties props = new Properties();
        props.put("mail.smtp.host", smtpServer);
        props.put("mail.smtp.port", String.valueOf(smtpPort));
        props.put("mail.smtp.starttls.enable", "true");
        props.put("mail.smtp.connectiontimeout", "10000");
        props.put("mail.smtp.timeout", "10000");

        Authenticator authenticator = null;
        if (password != null && !password.isEmpty()) {
            props.put("mail.smtp.auth", "true");
            authenticator = new Authenticator() {
                @Override
                protected PasswordAuthentication getPasswordAuthentication() {
                    return new PasswordAuthentication(sender, password);
                }
            };
        }

        this.session = Session.getInstance(props, authenticator);
        this.sender = sender;
        this.recipients = List.copyOf(recipients);
    }

    @Override
    public String channel() {
        return CHANNEL;
    }

    @Override
    public void send(NotificationEvent event) {
        try {
            Transport.send(buildMessage(event));
        } catch (MessagingException e) {
            throw new NotificationException(CHANNEL, e.getMessage(), e);
        }
    }

    MimeMessage buildMessage(NotificationEvent event) throws MessagingException {
        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress(sender));
        message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(String.join(",", recipients)));
        message.setSubject(subject(event), "UTF-8");
        message.setContent(body(event), "text/html; charset=UTF-8");
        return message;
    }

    static String subject(NotificationEvent event) {
        return "Training Job " + event.status().value().toUpperCase() + ": " + event.jobName();
    }

    static String body(NotificationEvent event) {
        StringBuilder html = new StringBuilder();
        html.append("<html><body>")
                .append("<h2>Training Job Status Update</h2>")
                .append("<table border=\"1\" cellpadding=\"5\">");
        row(html, "Job ID", event.jobId());
        row(html, "Name", event.jobName());
        rawRow(html, "Status", "<strong>" + escape(event.status().value()) + "</strong>");
        row(html, "Retry Count", event.retryCount() + "/" + event.maxRetries());
        row(html, "Started At", orNa(event.startedAt()));
        row(html, "Completed At", orNa(event.completedAt()));
        html.append("</table>")
                .append("<p><strong>Message:</strong> ").append(escape(event.message())).append("</p>");
        if (event.errorMessage() != null) {
            html.append("<p><strong>Error:</strong> ").append(escape(event.errorMessage())).append("</p>");
        }
        return html.append("</body></html>").toString();
    }

    private static void row(StringBuilder html, String header, String value) {
        rawRow(html, header, escape(value));
    }

    private static void rawRow(StringBuilder html, String header, String safeValue) {
        html.append("<tr><th>").append(header).append("</th><td>").append(safeValue).append("</td></tr>");
    }

    private static String orNa(Instant instant) {
        return instant != null ? instant.toString() : "N/A";
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }
}
