package automata.engine.store;

import automata.engine.config.EngineConfig;
import automata.engine.exception.StoreException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(EngineConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("automata-db-pool");
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

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- SCHEDULED TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS scheduled_tasks (
                            id                  VARCHAR(64) PRIMARY KEY,
                            user_id             VARCHAR(64),
                            name                VARCHAR(255) NOT NULL,
                            description         TEXT,
                            type                VARCHAR(20) NOT NULL,
                            schedule            TEXT,
                            trigger_config      TEXT,
                            action              TEXT NOT NULL,
                            conditions          TEXT,
                            retry_policy        TEXT,
                            notification_config TEXT,
                            status              VARCHAR(20) DEFAULT 'active' NOT NULL,
                            last_run_at         TIMESTAMP,
                            next_run_at         TIMESTAMP,
                            run_count           INT DEFAULT 0 NOT NULL,
                            claimed_by          VARCHAR(128),
                            claimed_until       TIMESTAMP,
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- TASK EXECUTIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_executions (
                            id              VARCHAR(64) PRIMARY KEY,
                            task_id         VARCHAR(64) NOT NULL REFERENCES scheduled_tasks(id) ON DELETE CASCADE,
                            status          VARCHAR(20) NOT NULL,
                            started_at      TIMESTAMP NOT NULL,
                            completed_at    TIMESTAMP,
                            duration_ms     BIGINT,
                            result          TEXT,
                            error           TEXT,
                            logs            TEXT
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_status_next_run ON scheduled_tasks(status, next_run_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_user_status ON scheduled_tasks(user_id, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_executions_task_started ON task_executions(task_id, started_at);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize database schema", e);
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
