package com.routemq.persistence;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Connection pool and schema for the metadata store.
 */
public class DatabaseManager {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseManager.class);

    public static final int DEFAULT_POOL_SIZE = 10;

    private final HikariDataSource dataSource;
    private final StorageDialect dialect;

    public DatabaseManager(String jdbcUrl, String username, String password) {
        this(jdbcUrl, username, password, DEFAULT_POOL_SIZE);
    }

    /**
     * @throws StorageException if the database cannot be reached or the schema cannot be created
     */
    public DatabaseManager(String jdbcUrl, String username, String password, int poolSize) {
        try {
            this.dialect = StorageDialect.detect(jdbcUrl);

            HikariConfig config = new HikariConfig();
            config.setJdbcUrl(jdbcUrl);
            config.setUsername(username);
            config.setPassword(password);
            config.setMaximumPoolSize(poolSize);
            config.setMinimumIdle(Math.min(2, poolSize));
            config.setIdleTimeout(300000);
            config.setConnectionTimeout(20000);
            config.setPoolName("routemq-store");

            this.dataSource = new HikariDataSource(config);
        } catch (RuntimeException e) {
            throw new StorageException("Failed to open metadata store at " + jdbcUrl, e);
        }

        initializeSchema();
        logger.info("Database manager initialized ({})", dialect);
    }

    /**
     * URL of an embedded H2 store under the given directory. Commits are written
     * to the file before they return; {@link JdbcStorageEngine} then syncs it.
     */
    public static String h2FileUrl(Path directory) {
        return "jdbc:h2:file:" + directory.toAbsolutePath().resolve("db") + ";WRITE_DELAY=0";
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public StorageDialect getDialect() {
        return dialect;
    }

    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    private void initializeSchema() {
        try (Connection conn = getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(dialect.getCreateTableSql());
            logger.info("Metadata schema initialized");
        } catch (SQLException e) {
            logger.error("Failed to initialize metadata schema", e);
            close();
            throw new StorageException("Metadata schema initialization failed", e);
        }
    }

    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            logger.info("Database connection pool closed");
        }
    }
}
