package retrain.orchestrator.store;

import retrain.orchestrator.model.Execution;
import retrain.orchestrator.model.ExecutionStatus;
import retrain.orchestrator.repository.ExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static retrain.orchestrator.store.JdbcJobRepository.toInstant;
import static retrain.orchestrator.store.JdbcJobRepository.toTimestamp;

/**
 * JDBC implementation of ExecutionRepository.
 * Terminal rows are never updated or deleted: every write to an existing row
 * is guarded by {@code status = 'RUNNING'}.
 */
public class JdbcExecutionRepository implements ExecutionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcExecutionRepository.class);

    private final Database db;

    public JdbcExecutionRepository(Database db) {
        this.db = db;
    }

    @Override
    public void append(Execution execution) {
        String sql = """
                    INSERT INTO job_executions (job_id, execution_number, status, started_at, completed_at,
                                                duration_seconds, error_message, checkpoint_used, backend_handle)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, execution.jobId());
            ps.setInt(2, execution.executionNumber());
            ps.setString(3, execution.status().name());
            ps.setTimestamp(4, toTimestamp(execution.startedAt()));
            ps.setTimestamp(5, toTimestamp(execution.completedAt()));
            if (execution.durationSeconds() != null) {
                ps.setLong(6, execution.durationSeconds());
            } else {
                ps.setNull(6, Types.BIGINT);
            }
            ps.setString(7, execution.errorMessage());
            ps.setString(8, execution.checkpointUsed());
            ps.setString(9, execution.backendHandle());

            ps.executeUpdate();
            conn.commit();

            log.debug("Appended execution {}", execution);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to append execution " + execution, e);
        }
    }

    @Override
    public boolean attachHandle(String jobId, int executionNumber, String handle) {
        String sql = """
                    UPDATE job_executions SET backend_handle = ?
                    WHERE job_id = ? AND execution_number = ? AND status = 'RUNNING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, handle);
            ps.setString(2, jobId);
            ps.setInt(3, executionNumber);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to attach handle to " + jobId + "#" + executionNumber, e);
        }
    }

    @Override
    public boolean finish(Execution terminal) {
        if (!terminal.status().isTerminal()) {
            throw new IllegalArgumentException("finish requires a terminal execution: " + terminal);
        }

        String sql = """
                    UPDATE job_executions
                    SET status = ?, completed_at = ?, duration_seconds = ?, error_message = ?, checkpoint_used = ?
                    WHERE job_id = ? AND execution_number = ? AND status = 'RUNNING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, terminal.status().name());
            ps.setTimestamp(2, toTimestamp(terminal.completedAt()));
            if (terminal.durationSeconds() != null) {
                ps.setLong(3, terminal.durationSeconds());
            } else {
                ps.setNull(3, Types.BIGINT);
            }
            ps.setString(4, terminal.errorMessage());
            ps.setString(5, terminal.checkpointUsed());
            ps.setString(6, terminal.jobId());
            ps.setInt(7, terminal.executionNumber());

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to finish execution " + terminal, e);
        }
    }

    @Override
    public boolean discard(String jobId, int executionNumber) {
        String sql = """
                    DELETE FROM job_executions
                    WHERE job_id = ? AND execution_number = ? AND status = 'RUNNING' AND backend_handle IS NULL
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ps.setInt(2, executionNumber);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to discard execution " + jobId + "#" + executionNumber, e);
        }
    }

    @Override
    public int lastExecutionNumber(String jobId) {
        String sql = "SELECT COALESCE(MAX(execution_number), 0) FROM job_executions WHERE job_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to read last execution number: " + jobId, e);
        }
    }

    @Override
    public Optional<Execution> findRunning(String jobId) {
        String sql = """
                    SELECT * FROM job_executions
                    WHERE job_id = ? AND status = 'RUNNING'
                    ORDER BY execution_number DESC
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            List<Execution> running = executeQuery(ps);
            if (running.size() > 1) {
                log.error("Job {} has {} running executions", jobId, running.size());
            }
            return running.isEmpty() ? Optional.empty() : Optional.of(running.get(0));
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to find running execution: " + jobId, e);
        }
    }

    @Override
    public int countRunning(String jobId) {
        String sql = "SELECT COUNT(*) FROM job_executions WHERE job_id = ? AND status = 'RUNNING'";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to count running executions: " + jobId, e);
        }
    }

    @Override
    public List<Execution> findByJobId(String jobId) {
        String sql = "SELECT * FROM job_executions WHERE job_id = ? ORDER BY execution_number";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to list executions: " + jobId, e);
        }
    }

    private List<Execution> executeQuery(PreparedStatement ps) throws SQLException {
        List<Execution> executions = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                executions.add(mapRow(rs));
            }
        }
        return executions;
    }

    private Execution mapRow(ResultSet rs) throws SQLException {
        long duration = rs.getLong("duration_seconds");
        Long durationSeconds = rs.wasNull() ? null : duration;

        return Execution.builder()
                .jobId(rs.getString("job_id"))
                .executionNumber(rs.getInt("execution_number"))
                .status(ExecutionStatus.valueOf(rs.getString("status")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .durationSeconds(durationSeconds)
                .errorMessage(rs.getString("error_message"))
                .checkpointUsed(rs.getString("checkpoint_used"))
                .backendHandle(rs.getString("backend_handle"))
                .build();
    }
}
