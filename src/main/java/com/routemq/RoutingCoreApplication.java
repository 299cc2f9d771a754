package com.routemq;

import com.routemq.config.BrokerConfig;
import com.routemq.persistence.JdbcStorageEngine;
import com.routemq.persistence.StorageException;
import com.routemq.server.RoutingBroker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;

public class RoutingCoreApplication {
    private static final Logger logger = LoggerFactory.getLogger(RoutingCoreApplication.class);

    public static void main(String[] args) {
        BrokerConfig config;
        try {
            config = parseArguments(args);
        } catch (Exception e) {
            logger.error("Failed to read configuration", e);
            System.exit(1);
            return;
        }

        logger.info("Starting routing core...");
        logger.info("Configuration: {}", config);

        RoutingBroker broker = startBroker(config);
        if (broker == null) {
            System.exit(1);
            return;
        }

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down routing core...");
            broker.stop();
            shutdown.countDown();
        }, "routemq-shutdown"));

        logger.info("Routing core ready");
        try {
            shutdown.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted");
        }
    }

    /**
     * Open the metadata store and recover the durable topology.
     *
     * @return the running broker, or {@code null} if startup failed and was logged
     */
    static RoutingBroker startBroker(BrokerConfig config) {
        JdbcStorageEngine storage;
        try {
            storage = JdbcStorageEngine.open(config);
        } catch (StorageException e) {
            logger.error("Cannot open metadata store", e);
            return null;
        }

        RoutingBroker broker = new RoutingBroker(storage, config.getVirtualHosts());
        try {
            broker.start();
        } catch (RuntimeException e) {
            logger.error("Failed to recover durable topology", e);
            broker.stop();
            return null;
        }
        return broker;
    }

    static BrokerConfig parseArguments(String[] args) throws IOException {
        BrokerConfig config = new BrokerConfig();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config":
                    if (i + 1 < args.length) {
                        Properties properties = new Properties();
                        try (InputStream in = Files.newInputStream(Paths.get(args[++i]))) {
                            properties.load(in);
                        }
                        config.loadFromProperties(properties);
                    }
                    break;
                case "--data-dir":
                    if (i + 1 < args.length) {
                        config.setDataDir(Paths.get(args[++i]));
                    }
                    break;
                case "--db-url":
                    if (i + 1 < args.length) {
                        config.setDatabaseUrl(args[++i]);
                    }
                    break;
                case "--db-user":
                    if (i + 1 < args.length) {
                        config.setDatabaseUser(args[++i]);
                    }
                    break;
                case "--db-password":
                    if (i + 1 < args.length) {
                        config.setDatabasePassword(args[++i]);
                    }
                    break;
                case "--help":
                    printUsage();
                    System.exit(0);
                    break;
                default:
                    if (args[i].startsWith("--")) {
                        System.err.println("Unknown option: " + args[i]);
                        printUsage();
                        System.exit(1);
                    }
            }
        }

        return config;
    }

    private static void printUsage() {
        System.out.println("RouteMQ routing core - exchange routing and durable topology store");
        System.out.println();
        System.out.println("Usage: java -jar routemq-core.jar [OPTIONS]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --config FILE         Properties file (data.dir, db.url, db.user, db.password,");
        System.out.println("                        db.pool.size, compaction.interval.minutes, vhosts)");
        System.out.println("  --data-dir DIR        Directory of the embedded metadata store (default: data)");
        System.out.println("  --db-url URL          JDBC URL of an external store, e.g. jdbc:postgresql://host/db");
        System.out.println("  --db-user USER        Database username");
        System.out.println("  --db-password PASS    Database password");
        System.out.println("  --help                Show this help message");
        System.out.println();
        System.out.println("Environment Variables:");
        System.out.println("  ROUTEMQ_DATA_DIR, ROUTEMQ_DB_URL, ROUTEMQ_DB_USER, ROUTEMQ_DB_PASSWORD,");
        System.out.println("  ROUTEMQ_COMPACTION_INTERVAL_MINUTES, ROUTEMQ_VHOSTS (comma separated)");
    }
}
