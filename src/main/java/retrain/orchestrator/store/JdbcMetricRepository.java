package retrain.orchestrator.store;

import retrain.orchestrator.model.MetricSample;
import retrain.orchestrator.repository.MetricRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static retrain.orchestrator.store.JdbcJobRepository.toInstant;

/**
 * JDBC implementation of MetricRepository.
 */
public class JdbcMetricRepository implements MetricRepository {

    private final Database db;

    public JdbcMetricRepository(Database db) {
        this.db = db;
    }

    @Override
    public void record(MetricSample sample) {
        String sql = "INSERT INTO metrics (job_id, metric_name, metric_value, recorded_at) VALUES (?, ?, ?, ?)";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, sample.jobId());
            ps.setString(2, sample.name());
            ps.setDouble(3, sample.value());
            ps.setTimestamp(4, Timestamp.from(sample.recordedAt() != null ? sample.recordedAt() : Instant.now()));

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to record metric " + sample.name() + " for " + sample.jobId(), e);
        }
    }

    @Override
    public List<MetricSample> findByJobId(String jobId) {
        String sql = "SELECT * FROM metrics WHERE job_id = ? ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            List<MetricSample> samples = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    samples.add(new MetricSample(
                            rs.getString("job_id"),
                            rs.getString("metric_name"),
                            rs.getDouble("metric_value"),
                            toInstant(rs.getTimestamp("recorded_at"))));
                }
            }
            return samples;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to list metrics: " + jobId, e);
        }
    }
}
