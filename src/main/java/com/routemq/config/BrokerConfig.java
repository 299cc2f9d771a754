package com.routemq.config;

import com.routemq.amqp.AmqpConstants;
import com.routemq.persistence.DatabaseManager;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Configuration for the routing core.
 * Defaults are overridden by environment variables, then by a properties file or setters.
 */
public class BrokerConfig {

    // Metadata store
    private Path dataDir = Paths.get("data");
    private String databaseUrl = null; // null = embedded store under dataDir
    private String databaseUser = "sa";
    private String databasePassword = "";
    private int databasePoolSize = DatabaseManager.DEFAULT_POOL_SIZE;
    private long compactionIntervalMinutes = 30;

    // Virtual hosts created at startup
    private List<String> virtualHosts = new ArrayList<>(List.of(AmqpConstants.DEFAULT_VIRTUAL_HOST));

    public BrokerConfig() {
        this(System.getenv());
    }

    BrokerConfig(Map<String, String> env) {
        loadFromEnvironment(env);
    }

    /**
     * Load configuration from environment variables.
     */
    private void loadFromEnvironment(Map<String, String> env) {
        if (env.containsKey("ROUTEMQ_DATA_DIR")) {
            dataDir = Paths.get(env.get("ROUTEMQ_DATA_DIR"));
        }
        if (env.containsKey("ROUTEMQ_DB_URL")) {
            databaseUrl = env.get("ROUTEMQ_DB_URL");
        }
        if (env.containsKey("ROUTEMQ_DB_USER")) {
            databaseUser = env.get("ROUTEMQ_DB_USER");
        }
        if (env.containsKey("ROUTEMQ_DB_PASSWORD")) {
            databasePassword = env.get("ROUTEMQ_DB_PASSWORD");
        }
        if (env.containsKey("ROUTEMQ_COMPACTION_INTERVAL_MINUTES")) {
            setCompactionIntervalMinutes(Long.parseLong(env.get("ROUTEMQ_COMPACTION_INTERVAL_MINUTES")));
        }
        if (env.containsKey("ROUTEMQ_VHOSTS")) {
            virtualHosts = parseList(env.get("ROUTEMQ_VHOSTS"));
        }
    }

    /**
     * Load configuration from Properties object.
     */
    public void loadFromProperties(Properties properties) {
        if (properties.containsKey("data.dir")) {
            dataDir = Paths.get(properties.getProperty("data.dir"));
        }
        if (properties.containsKey("db.url")) {
            databaseUrl = properties.getProperty("db.url");
        }
        if (properties.containsKey("db.user")) {
            databaseUser = properties.getProperty("db.user");
        }
        if (properties.containsKey("db.password")) {
            databasePassword = properties.getProperty("db.password");
        }
        if (properties.containsKey("db.pool.size")) {
            databasePoolSize = Integer.parseInt(properties.getProperty("db.pool.size").trim());
        }
        if (properties.containsKey("compaction.interval.minutes")) {
            setCompactionIntervalMinutes(Long.parseLong(properties.getProperty("compaction.interval.minutes").trim()));
        }
        if (properties.containsKey("vhosts")) {
            virtualHosts = parseList(properties.getProperty("vhosts"));
        }
    }

    private static List<String> parseList(String value) {
        List<String> items = new ArrayList<>();
        for (String item : value.split(",")) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        if (items.isEmpty()) {
            items.add(AmqpConstants.DEFAULT_VIRTUAL_HOST);
        }
        return items;
    }

    /**
     * The JDBC URL to open: the configured one, or the embedded store in the data directory.
     */
    public String getJdbcUrl() {
        return databaseUrl != null ? databaseUrl : DatabaseManager.h2FileUrl(dataDir);
    }

    /**
     * Export configuration as a map. The password is not included.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("dataDir", dataDir.toString());
        map.put("jdbcUrl", getJdbcUrl());
        map.put("databaseUser", databaseUser);
        map.put("databasePoolSize", databasePoolSize);
        map.put("compactionIntervalMinutes", compactionIntervalMinutes);
        map.put("virtualHosts", List.copyOf(virtualHosts));
        return map;
    }

    // Getters and setters

    public Path getDataDir() {
        return dataDir;
    }

    public void setDataDir(Path dataDir) {
        this.dataDir = dataDir;
    }

    public String getDatabaseUrl() {
        return databaseUrl;
    }

    public void setDatabaseUrl(String databaseUrl) {
        this.databaseUrl = databaseUrl;
    }

    public String getDatabaseUser() {
        return databaseUser;
    }

    public void setDatabaseUser(String databaseUser) {
        this.databaseUser = databaseUser;
    }

    public String getDatabasePassword() {
        return databasePassword;
    }

    public void setDatabasePassword(String databasePassword) {
        this.databasePassword = databasePassword;
    }

    public int getDatabasePoolSize() {
        return databasePoolSize;
    }

    public void setDatabasePoolSize(int databasePoolSize) {
        this.databasePoolSize = databasePoolSize;
    }

    public long getCompactionIntervalMinutes() {
        return compactionIntervalMinutes;
    }

    public void setCompactionIntervalMinutes(long compactionIntervalMinutes) {
        if (compactionIntervalMinutes <= 0) {
            throw new IllegalArgumentException("compaction interval must be > 0 minutes");
        }
        this.compactionIntervalMinutes = compactionIntervalMinutes;
    }

    public Duration getCompactionInterval() {
        return Duration.ofMinutes(compactionIntervalMinutes);
    }

    public List<String> getVirtualHosts() {
        return virtualHosts;
    }

    public void setVirtualHosts(List<String> virtualHosts) {
        this.virtualHosts = new ArrayList<>(virtualHosts);
    }

    @Override
    public String toString() {
        return String.format("BrokerConfig{store='%s', poolSize=%d, compactionIntervalMinutes=%d, vhosts=%s}",
                           getJdbcUrl(), databasePoolSize, compactionIntervalMinutes, virtualHosts);
    }
}
