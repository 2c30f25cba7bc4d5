package voicecover.engine.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import voicecover.engine.config.EngineConfig;
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
        hikariConfig.setPoolName("voicecover-db-pool");
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

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS cover_jobs (
                            id                   VARCHAR(64) PRIMARY KEY,
                            status               VARCHAR(20) NOT NULL DEFAULT 'QUEUED',
                            stage                VARCHAR(20),
                            progress             INT NOT NULL DEFAULT 0,
                            reference_voice_path VARCHAR(2048) NOT NULL,
                            song_path            VARCHAR(2048) NOT NULL,
                            parameters           CLOB NOT NULL,
                            output_path          VARCHAR(2048),
                            error_message        VARCHAR(4096),
                            cancel_requested     BOOLEAN NOT NULL DEFAULT FALSE,
                            task_handle          VARCHAR(128),
                            claimed_by           VARCHAR(128),
                            heartbeat_at         TIMESTAMP,
                            created_at           TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at           TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            expires_at           TIMESTAMP,
                            artifacts_purged_at  TIMESTAMP
                        );
                    """);

            st.addBatch("CREATE INDEX IF NOT EXISTS idx_cover_jobs_status_created ON cover_jobs(status, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_cover_jobs_expires ON cover_jobs(expires_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_cover_jobs_claim ON cover_jobs(claimed_by, heartbeat_at);");

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
