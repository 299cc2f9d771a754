package com.routemq.persistence;

import com.routemq.config.BrokerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link StorageEngine} backed by a single {@code kv_store} table over JDBC.
 * Each batch is one database transaction, forced to the device before the call
 * returns; isolation between batches, reads and compaction is left to the database.
 */
public class JdbcStorageEngine implements StorageEngine {
    private static final Logger logger = LoggerFactory.getLogger(JdbcStorageEngine.class);

    public static final Duration DEFAULT_COMPACTION_INTERVAL = Duration.ofMinutes(30);

    private static final int SCAN_FETCH_SIZE = 256;

    private final DatabaseManager databaseManager;
    private final StorageDialect dialect;
    private final CompactionScheduler compactionScheduler;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public JdbcStorageEngine(DatabaseManager databaseManager) {
        this(databaseManager, DEFAULT_COMPACTION_INTERVAL);
    }

    public JdbcStorageEngine(DatabaseManager databaseManager, Duration compactionInterval) {
        this.databaseManager = databaseManager;
        this.dialect = databaseManager.getDialect();
        this.compactionScheduler = new CompactionScheduler(this::compact, compactionInterval);
        this.compactionScheduler.start();
    }

    /**
     * Open or create an embedded store in the given directory.
     *
     * @throws StorageException if the store cannot be opened
     */
    public static JdbcStorageEngine openAt(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directory " + directory, e);
        }
        return new JdbcStorageEngine(new DatabaseManager(DatabaseManager.h2FileUrl(directory), "sa", ""));
    }

    /**
     * Open the store described by the broker configuration.
     *
     * @throws StorageException if the store cannot be opened
     */
    public static JdbcStorageEngine open(BrokerConfig config) {
        if (config.getDatabaseUrl() == null) {
            try {
                Files.createDirectories(config.getDataDir());
            } catch (IOException e) {
                throw new StorageException("Cannot create storage directory " + config.getDataDir(), e);
            }
        }
        DatabaseManager databaseManager = new DatabaseManager(
            config.getJdbcUrl(), config.getDatabaseUser(), config.getDatabasePassword(),
            config.getDatabasePoolSize());
        return new JdbcStorageEngine(databaseManager, config.getCompactionInterval());
    }

    @Override
    public void applyBatch(List<StorageOperation> operations) {
        ensureOpen();
        if (operations.isEmpty()) {
            return;
        }

        try (Connection conn = databaseManager.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement upsert = conn.prepareStatement(dialect.getUpsertSql());
                 PreparedStatement delete = conn.prepareStatement(StorageDialect.DELETE_SQL)) {
                for (StorageOperation operation : operations) {
                    if (operation.getKind() == StorageOperation.Kind.SET) {
                        upsert.setString(1, operation.getKey());
                        upsert.setBytes(2, operation.getValue());
                        upsert.executeUpdate();
                    } else {
                        delete.setString(1, operation.getKey());
                        delete.executeUpdate();
                    }
                }
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                rollback(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
            if (dialect.getSyncSql() != null) {
                try (Statement sync = conn.createStatement()) {
                    sync.execute(dialect.getSyncSql());
                }
            }
            logger.debug("Applied batch of {} operations", operations.size());
        } catch (SQLException e) {
            throw new StorageException("Failed to apply batch of " + operations.size() + " operations", e);
        }
    }

    private static void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    @Override
    public Optional<byte[]> get(String key) {
        ensureOpen();
        try (Connection conn = databaseManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(StorageDialect.SELECT_ONE_SQL)) {
            stmt.setString(1, key);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getBytes(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read key " + key, e);
        }
    }

    @Override
    public void iterateAll(StorageVisitor visitor) {
        ensureOpen();
        try (Connection conn = databaseManager.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.setFetchSize(SCAN_FETCH_SIZE);
            try (ResultSet rs = stmt.executeQuery(dialect.getScanSql())) {
                while (rs.next()) {
                    if (!visitor.visit(rs.getString(1), rs.getBytes(2))) {
                        break;
                    }
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to iterate metadata store", e);
        }
    }

    @Override
    public void compact() {
        ensureOpen();
        try (Connection conn = databaseManager.getConnection();
             Statement stmt = conn.createStatement()) {
            conn.setAutoCommit(true);
            stmt.execute(dialect.getCompactSql());
            if (dialect == StorageDialect.H2) {
                H2StoreCompactor.compactFile(conn);
            }
            logger.debug("Executed compaction: {}", dialect.getCompactSql());
        } catch (SQLException e) {
            throw new StorageException("Compaction failed", e);
        }
    }

    CompactionScheduler getCompactionScheduler() {
        return compactionScheduler;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        compactionScheduler.close();
        databaseManager.close();
        logger.info("Storage engine closed");
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new StorageException("Storage engine is closed");
        }
    }
}
