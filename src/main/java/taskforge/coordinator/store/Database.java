package taskforge.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import taskforge.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling. Connections are handed out with
 * auto-commit disabled; callers commit explicitly.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("taskforge-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
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

            // ---------- TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tasks (
                            id                 VARCHAR(64) PRIMARY KEY,
                            status             VARCHAR(20) NOT NULL DEFAULT 'QUEUED',
                            prompt             CLOB NOT NULL,
                            code               CLOB,
                            timeout_seconds    INT NOT NULL DEFAULT 300,
                            worker_id          VARCHAR(128),
                            result             CLOB,
                            error_message      CLOB,
                            execution_time_ms  BIGINT,
                            created_at         TIMESTAMP NOT NULL,
                            started_at         TIMESTAMP,
                            completed_at       TIMESTAMP
                        );
                    """);

            // ---------- DISPATCH JOBS (broker) ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS dispatch_jobs (
                            task_id            VARCHAR(64) PRIMARY KEY,
                            prompt             CLOB NOT NULL,
                            code               CLOB,
                            timeout_seconds    INT NOT NULL,
                            state              VARCHAR(20) NOT NULL,
                            attempts           INT NOT NULL DEFAULT 0,
                            max_attempts       INT NOT NULL,
                            available_at       TIMESTAMP NOT NULL,
                            worker_id          VARCHAR(128),
                            lease_deadline     TIMESTAMP,
                            last_error         CLOB,
                            enqueued_at        TIMESTAMP NOT NULL,
                            finished_at        TIMESTAMP
                        );
                    """);

            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_status_created ON tasks(status, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_dispatch_state_available ON dispatch_jobs(state, available_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_dispatch_state_finished ON dispatch_jobs(state, finished_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_dispatch_lease ON dispatch_jobs(state, lease_deadline);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
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
