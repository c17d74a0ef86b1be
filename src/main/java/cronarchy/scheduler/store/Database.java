package cronarchy.scheduler.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import cronarchy.scheduler.config.SchedulerConfig;
import cronarchy.scheduler.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.regex.Pattern;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final HikariDataSource dataSource;

    public Database(SchedulerConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("cronarchy-db-pool");
        hikariConfig.setAutoCommit(false);

        // H2 specific settings
        if (jdbcUrl.contains("h2:")) {
            hikariConfig.addDataSourceProperty("MODE", "PostgreSQL");
        }

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        // Initialize shared schema
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
     * Get the underlying DataSource (for frameworks that need it).
     */
    public DataSource getDataSource() {
        return dataSource;
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

    /**
     * Create an instance's jobs table if it does not exist yet.
     */
    public void createJobsTable(String table) {
        if (!TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            st.addBatch("CREATE TABLE IF NOT EXISTS " + table + " (\n"
                    + "    id          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,\n"
                    + "    hook        VARCHAR(255) NOT NULL,\n"
                    + "    args        VARCHAR(16384) NOT NULL,\n"
                    + "    due_at      TIMESTAMP WITH TIME ZONE NOT NULL,\n"
                    + "    recurrence  BIGINT DEFAULT NULL\n"
                    + ");");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_" + table + "_due_at ON " + table + "(due_at);");

            st.executeBatch();
            conn.commit();

            log.info("Jobs table {} initialized", table);
        } catch (SQLException e) {
            throw new StorageException("Failed to create jobs table " + table, e);
        }
    }

    /**
     * Initialize database schema shared by all instances.
     */
    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- OPTIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS options (
                            name        VARCHAR(191) PRIMARY KEY,
                            val         VARCHAR(1024) NOT NULL
                        );
                    """);

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new StorageException("Failed to initialize database schema", e);
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
