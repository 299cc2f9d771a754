package com.routemq.persistence;

/**
 * SQL that differs between the databases the metadata store can run on.
 */
public enum StorageDialect {

    H2("jdbc:h2:",
        "CREATE TABLE IF NOT EXISTS kv_store (k VARCHAR(1024) PRIMARY KEY, v VARBINARY(1048576) NOT NULL)",
        "MERGE INTO kv_store (k, v) KEY (k) VALUES (?, ?)",
        "SELECT k, v FROM kv_store ORDER BY k",
        "CHECKPOINT SYNC",
        // Writes pending changes; the engine then compacts the file itself
        "CHECKPOINT SYNC"),

    POSTGRESQL("jdbc:postgresql:",
        "CREATE TABLE IF NOT EXISTS kv_store (k VARCHAR(1024) PRIMARY KEY, v BYTEA NOT NULL)",
        "INSERT INTO kv_store (k, v) VALUES (?, ?) ON CONFLICT (k) DO UPDATE SET v = EXCLUDED.v",
        "SELECT k, v FROM kv_store ORDER BY k COLLATE \"C\"",
        // Commits are fsynced by the server while synchronous_commit is on
        null,
        "VACUUM kv_store");

    public static final String SELECT_ONE_SQL = "SELECT v FROM kv_store WHERE k = ?";
    public static final String DELETE_SQL = "DELETE FROM kv_store WHERE k = ?";

    private final String jdbcUrlPrefix;
    private final String createTableSql;
    private final String upsertSql;
    private final String scanSql;
    private final String syncSql;
    private final String compactSql;

    StorageDialect(String jdbcUrlPrefix, String createTableSql, String upsertSql,
                   String scanSql, String syncSql, String compactSql) {
        this.jdbcUrlPrefix = jdbcUrlPrefix;
        this.createTableSql = createTableSql;
        this.upsertSql = upsertSql;
        this.scanSql = scanSql;
        this.syncSql = syncSql;
        this.compactSql = compactSql;
    }

    public String getCreateTableSql() {
        return createTableSql;
    }

    public String getUpsertSql() {
        return upsertSql;
    }

    /**
     * Full scan in ascending key order, compared by code point.
     */
    public String getScanSql() {
        return scanSql;
    }

    /**
     * Statement forcing committed data to the device, or {@code null} if a commit already does.
     */
    public String getSyncSql() {
        return syncSql;
    }

    /**
     * Must run outside a transaction.
     */
    public String getCompactSql() {
        return compactSql;
    }

    /**
     * @throws IllegalArgumentException if no dialect supports the URL
     */
    public static StorageDialect detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }
        for (StorageDialect dialect : values()) {
            if (jdbcUrl.startsWith(dialect.jdbcUrlPrefix)) {
                return dialect;
            }
        }
        throw new IllegalArgumentException("No storage dialect for JDBC URL: " + jdbcUrl +
            ". Supported prefixes: jdbc:h2:, jdbc:postgresql:");
    }
}
