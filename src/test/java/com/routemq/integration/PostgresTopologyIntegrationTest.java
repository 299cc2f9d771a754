package com.routemq.integration;

import com.routemq.AbstractPostgresTest;
import com.routemq.model.Exchange;
import com.routemq.persistence.DatabaseManager;
import com.routemq.persistence.JdbcStorageEngine;
import com.routemq.persistence.StorageException;
import com.routemq.persistence.StorageOperation;
import com.routemq.server.RoutingBroker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PostgreSQL Topology Integration Tests")
class PostgresTopologyIntegrationTest extends AbstractPostgresTest {

    private JdbcStorageEngine storage;

    @BeforeEach
    void setUp() throws SQLException {
        try (Connection conn = databaseManager.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute("TRUNCATE kv_store");
        }
        storage = openEngine();
    }

    @AfterEach
    void tearDown() {
        storage.close();
    }

    private JdbcStorageEngine openEngine() {
        return new JdbcStorageEngine(
            new DatabaseManager(getJdbcUrl(), getUsername(), getPassword(), 4),
            Duration.ofHours(1));
    }

    @Test
    @DisplayName("Keys are scanned in byte order")
    void testOrderedScan() {
        storage.set("b", new byte[] {2});
        storage.set("B", new byte[] {1});
        storage.set("a", new byte[] {3});

        List<String> keys = new ArrayList<>();
        storage.iterateAll((key, value) -> keys.add(key));

        assertThat(keys).containsExactly("B", "a", "b");
    }

    @Test
    @DisplayName("A failing batch leaves no partial state")
    void testAtomicBatch() {
        assertThatThrownBy(() -> storage.applyBatch(List.of(
            StorageOperation.set("a", new byte[] {1}),
            StorageOperation.set("k".repeat(2000), new byte[] {2}))))
            .isInstanceOf(StorageException.class);

        assertThat(storage.get("a")).isEmpty();
    }

    @Test
    @DisplayName("Vacuum runs outside a transaction")
    void testCompact() {
        storage.set("a", new byte[] {1});

        assertThatCode(storage::compact).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Topology survives a broker restart")
    void testRecoveryAfterRestart() {
        RoutingBroker broker = new RoutingBroker(storage);
        broker.start();
        broker.declareExchange("/", "events", "topic", false, true, false, false, false, null);
        broker.bindQueue("/", "audit", "events", "user.#", Map.of());
        broker.stop();

        storage = openEngine();
        RoutingBroker restarted = new RoutingBroker(storage);
        restarted.start();

        Exchange recovered = restarted.getVirtualHost("/").getExchange("events");
        assertThat(recovered).isNotNull();
        assertThat(restarted.route("/", "events", "user.login", null)).containsExactly("audit");
    }
}
