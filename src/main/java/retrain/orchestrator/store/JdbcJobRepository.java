package retrain.orchestrator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import retrain.orchestrator.model.Job;
import retrain.orchestrator.model.JobStatus;
import retrain.orchestrator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of JobRepository.
 * The command list is stored as a JSON array.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> COMMAND_TYPE = new TypeReference<>() {
    };

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Job job) {
        String sql = """
                    INSERT INTO jobs (id, name, image, command, schedule, max_retries, retry_count,
                                      checkpoint_path, status, last_started_at, last_completed_at,
                                      error_message, last_checked_at, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant created = job.createdAt() != null ? job.createdAt() : Instant.now();
            ps.setString(1, job.id());
            ps.setString(2, job.name());
            ps.setString(3, job.image());
            ps.setString(4, writeCommand(job.command()));
            ps.setString(5, job.schedule());
            ps.setInt(6, job.maxRetries());
            ps.setInt(7, job.retryCount());
            ps.setString(8, job.checkpointPath());
            ps.setString(9, job.status().name());
            ps.setTimestamp(10, toTimestamp(job.lastStartedAt()));
            ps.setTimestamp(11, toTimestamp(job.lastCompletedAt()));
            ps.setString(12, job.errorMessage());
            ps.setTimestamp(13, toTimestamp(job.lastCheckedAt()));
            ps.setTimestamp(14, Timestamp.from(created));
            ps.setTimestamp(15, Timestamp.from(job.updatedAt() != null ? job.updatedAt() : created));

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved job: {}", job.id());
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to save job: " + job.id(), e);
        }
    }

    @Override
    public boolean update(Job job) {
        String sql = """
                    UPDATE jobs SET name = ?, image = ?, command = ?, schedule = ?, max_retries = ?,
                                    retry_count = ?, checkpoint_path = ?, status = ?, last_started_at = ?,
                                    last_completed_at = ?, error_message = ?, last_checked_at = ?,
                                    updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, job.name());
            ps.setString(2, job.image());
            ps.setString(3, writeCommand(job.command()));
            ps.setString(4, job.schedule());
            ps.setInt(5, job.maxRetries());
            ps.setInt(6, job.retryCount());
            ps.setString(7, job.checkpointPath());
            ps.setString(8, job.status().name());
            ps.setTimestamp(9, toTimestamp(job.lastStartedAt()));
            ps.setTimestamp(10, toTimestamp(job.lastCompletedAt()));
            ps.setString(11, job.errorMessage());
            ps.setTimestamp(12, toTimestamp(job.lastCheckedAt()));
            ps.setTimestamp(13, Timestamp.from(job.updatedAt() != null ? job.updatedAt() : Instant.now()));
            ps.setString(14, job.id());

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to update job: " + job.id(), e);
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        return findOne("SELECT * FROM jobs WHERE id = ?", jobId);
    }

    @Override
    public Optional<Job> findByName(String name) {
        return findOne("SELECT * FROM jobs WHERE name = ?", name);
    }

    @Override
    public List<Job> findAll() {
        String sql = "SELECT * FROM jobs ORDER BY created_at DESC, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to list jobs", e);
        }
    }

    @Override
    public List<Job> findPage(JobStatus status, int offset, int limit) {
        String sql = status == null
                ? "SELECT * FROM jobs ORDER BY created_at DESC, id LIMIT ? OFFSET ?"
                : "SELECT * FROM jobs WHERE status = ? ORDER BY created_at DESC, id LIMIT ? OFFSET ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            if (status != null) {
                ps.setString(i++, status.name());
            }
            ps.setInt(i++, limit);
            ps.setInt(i, offset);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to page jobs", e);
        }
    }

    @Override
    public int count(JobStatus status) {
        String sql = status == null
                ? "SELECT COUNT(*) FROM jobs"
                : "SELECT COUNT(*) FROM jobs WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            if (status != null) {
                ps.setString(1, status.name());
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to count jobs", e);
        }
    }

    @Override
    public Map<JobStatus, Integer> countByStatus() {
        String sql = "SELECT status, COUNT(*) AS cnt FROM jobs GROUP BY status";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            Map<JobStatus, Integer> counts = new EnumMap<>(JobStatus.class);
            while (rs.next()) {
                counts.put(JobStatus.valueOf(rs.getString("status")), rs.getInt("cnt"));
            }
            return counts;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to count jobs by status", e);
        }
    }

    @Override
    public boolean delete(String jobId) {
        // First delete executions, then job
        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM job_executions WHERE job_id = ?")) {
                ps.setString(1, jobId);
                ps.executeUpdate();
            }

            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM jobs WHERE id = ?")) {
                ps.setString(1, jobId);
                int deleted = ps.executeUpdate();
                conn.commit();
                return deleted > 0;
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to delete job: " + jobId, e);
        }
    }

    @Override
    public String generateId() {
        return "train-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    // --- Helpers ---

    private Optional<Job> findOne(String sql, String param) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, param);
            List<Job> jobs = executeQuery(ps);
            return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to find job: " + param, e);
        }
    }

    private List<Job> executeQuery(PreparedStatement ps) throws SQLException {
        List<Job> jobs = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                jobs.add(mapRow(rs));
            }
        }
        return jobs;
    }

    private Job mapRow(ResultSet rs) throws SQLException {
        return Job.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .image(rs.getString("image"))
                .command(readCommand(rs.getString("command")))
                .schedule(rs.getString("schedule"))
                .maxRetries(rs.getInt("max_retries"))
                .retryCount(rs.getInt("retry_count"))
                .checkpointPath(rs.getString("checkpoint_path"))
                .status(JobStatus.valueOf(rs.getString("status")))
                .lastStartedAt(toInstant(rs.getTimestamp("last_started_at")))
                .lastCompletedAt(toInstant(rs.getTimestamp("last_completed_at")))
                .errorMessage(rs.getString("error_message"))
                .lastCheckedAt(toInstant(rs.getTimestamp("last_checked_at")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    private static String writeCommand(List<String> command) {
        try {
            return MAPPER.writeValueAsString(command);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Command cannot be serialized", e);
        }
    }

    private static List<String> readCommand(String json) throws SQLException {
        try {
            return MAPPER.readValue(json, COMMAND_TYPE);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt command column: " + json, e);
        }
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
