package conveyor.orchestrator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import conveyor.orchestrator.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling. The schema sticks to types shared by
 * H2 (PostgreSQL mode) and PostgreSQL.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

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
        hikariConfig.setPoolName("conveyor-db-pool");
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

            // ---------- RUNS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS runs (
                            id                VARCHAR(64) PRIMARY KEY,
                            pipeline_name     VARCHAR(256) NOT NULL,
                            pipeline          TEXT NOT NULL,
                            arguments         TEXT,
                            annotations       TEXT,
                            status            VARCHAR(20) DEFAULT 'PENDING',
                            cancel_requested  BOOLEAN DEFAULT FALSE,
                            error_message     VARCHAR(2048),
                            created_at        TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            started_at        TIMESTAMP,
                            finished_at       TIMESTAMP
                        );
                    """);

            // ---------- TASK EXECUTIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_executions (
                            run_id            VARCHAR(64) NOT NULL,
                            task_id           VARCHAR(256) NOT NULL,
                            seq_no            INT NOT NULL,
                            status            VARCHAR(20) DEFAULT 'PENDING',
                            resolved_inputs   TEXT,
                            execution_id      VARCHAR(64),
                            handle            VARCHAR(512),
                            retry_count       INT DEFAULT 0,
                            infra_retry_count INT DEFAULT 0,
                            not_before        TIMESTAMP,
                            error_message     VARCHAR(2048),
                            created_at        TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            started_at        TIMESTAMP,
                            finished_at       TIMESTAMP,
                            PRIMARY KEY (run_id, task_id)
                        );
                    """);

            // ---------- TASK OUTPUTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_outputs (
                            run_id            VARCHAR(64) NOT NULL,
                            task_id           VARCHAR(256) NOT NULL,
                            output_name       VARCHAR(256) NOT NULL,
                            artifact_uri      VARCHAR(2048) NOT NULL,
                            PRIMARY KEY (run_id, task_id, output_name)
                        );
                    """);

            // ---------- TASK ATTEMPTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_attempts (
                            run_id            VARCHAR(64) NOT NULL,
                            task_id           VARCHAR(256) NOT NULL,
                            attempt           INT NOT NULL,
                            execution_id      VARCHAR(64),
                            handle            VARCHAR(512),
                            status            VARCHAR(20) NOT NULL,
                            error_message     VARCHAR(2048),
                            started_at        TIMESTAMP,
                            finished_at       TIMESTAMP,
                            PRIMARY KEY (run_id, task_id, attempt)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_runs_status ON runs(status, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_task_exec_status ON task_executions(status, started_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_task_exec_run_status ON task_executions(run_id, status);");

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
