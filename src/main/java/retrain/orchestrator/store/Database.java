package retrain.orchestrator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import retrain.orchestrator.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import retrain.orchestrator.repository.UnitOfWork;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.function.Supplier;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 *
 * <p>Inside {@link #inTransaction} the thread is bound to one connection:
 * {@link #getConnection()} hands out that connection, and its {@code commit}
 * and {@code close} are left to the transaction.
 */
public final class Database implements UnitOfWork, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;
    private final ThreadLocal<Connection> transaction = new ThreadLocal<>();

    public Database(OrchestratorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("retrain-db-pool");
        hikariConfig.setAutoCommit(false);

        // H2 specific settings
        if (jdbcUrl.contains("h2:")) {
            hikariConfig.addDataSourceProperty("MODE", "PostgreSQL");
        }

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool, or the current transaction's connection.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        Connection bound = transaction.get();
        return bound != null ? joined(bound) : dataSource.getConnection();
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        if (transaction.get() != null) {
            return work.get();
        }
        try (Connection conn = dataSource.getConnection()) {
            transaction.set(conn);
            try {
                T result = work.get();
                conn.commit();
                return result;
            } catch (RuntimeException e) {
                rollback(conn, e);
                throw e;
            } finally {
                transaction.remove();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Transaction failed", e);
        }
    }

    private static void rollback(Connection conn, RuntimeException cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    /** View of a transaction's connection whose commit and close belong to the transaction */
    private static Connection joined(Connection conn) {
        return (Connection) Proxy.newProxyInstance(Database.class.getClassLoader(),
                new Class<?>[] { Connection.class },
                (proxy, method, args) -> {
                    String name = method.getName();
                    if (name.equals("commit") || name.equals("close")) {
                        return null;
                    }
                    try {
                        return method.invoke(conn, args);
                    } catch (InvocationTargetException e) {
                        throw e.getCause();
                    }
                });
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- JOBS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id                VARCHAR(64) PRIMARY KEY,
                            name              VARCHAR(100) NOT NULL,
                            image             VARCHAR(500) NOT NULL,
                            command           CLOB NOT NULL,
                            schedule          VARCHAR(100) NOT NULL,
                            max_retries       INT NOT NULL DEFAULT 3,
                            retry_count       INT NOT NULL DEFAULT 0,
                            checkpoint_path   VARCHAR(500),
                            status            VARCHAR(20) NOT NULL DEFAULT 'PENDING',
                            last_started_at   TIMESTAMP,
                            last_completed_at TIMESTAMP,
                            error_message     CLOB,
                            last_checked_at   TIMESTAMP,
                            created_at        TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at        TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT uq_jobs_name UNIQUE (name)
                        );
                    """);

            // ---------- EXECUTIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_executions (
                            job_id            VARCHAR(64) NOT NULL,
                            execution_number  INT NOT NULL,
                            status            VARCHAR(20) NOT NULL,
                            started_at        TIMESTAMP NOT NULL,
                            completed_at      TIMESTAMP,
                            duration_seconds  BIGINT,
                            error_message     CLOB,
                            checkpoint_used   VARCHAR(500),
                            backend_handle    VARCHAR(256),
                            PRIMARY KEY (job_id, execution_number)
                        );
                    """);

            // ---------- NOTIFICATIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS notifications (
                            id             BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            job_id         VARCHAR(64) NOT NULL,
                            channel        VARCHAR(50) NOT NULL,
                            message        CLOB NOT NULL,
                            status         VARCHAR(20) NOT NULL,
                            error_message  CLOB,
                            sent_at        TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- METRICS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS metrics (
                            id            BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            job_id        VARCHAR(64) NOT NULL,
                            metric_name   VARCHAR(100) NOT NULL,
                            metric_value  DOUBLE PRECISION NOT NULL,
                            recorded_at   TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_status ON jobs(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_created_at ON jobs(created_at DESC);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_executions_status ON job_executions(job_id, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_notifications_job_id ON notifications(job_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_metrics_job_id ON metrics(job_id);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
