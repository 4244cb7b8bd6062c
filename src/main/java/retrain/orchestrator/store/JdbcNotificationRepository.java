package retrain.orchestrator.store;

import retrain.orchestrator.model.NotificationRecord;
import retrain.orchestrator.repository.NotificationRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static retrain.orchestrator.store.JdbcJobRepository.toInstant;

/**
 * JDBC implementation of NotificationRepository.
 */
public class JdbcNotificationRepository implements NotificationRepository {

    private final Database db;

    public JdbcNotificationRepository(Database db) {
        this.db = db;
    }

    @Override
    public void append(NotificationRecord record) {
        String sql = """
                    INSERT INTO notifications (job_id, channel, message, status, error_message, sent_at)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, record.jobId());
            ps.setString(2, record.channel());
            ps.setString(3, record.message());
            ps.setString(4, record.status());
            ps.setString(5, record.errorMessage());
            ps.setTimestamp(6, Timestamp.from(record.sentAt() != null ? record.sentAt() : Instant.now()));

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to record notification for job " + record.jobId(), e);
        }
    }

    @Override
    public List<NotificationRecord> findByJobId(String jobId) {
        String sql = "SELECT * FROM notifications WHERE job_id = ? ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            List<NotificationRecord> records = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(new NotificationRecord(
                            rs.getString("channel"),
                            rs.getString("job_id"),
                            rs.getString("message"),
                            "sent".equals(rs.getString("status")),
                            rs.getString("error_message"),
                            toInstant(rs.getTimestamp("sent_at"))));
                }
            }
            return records;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to list notifications: " + jobId, e);
        }
    }
}
