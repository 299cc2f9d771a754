package com.routemq.server;

import com.routemq.amqp.AmqpException;
import com.routemq.model.ExchangeType;
import com.routemq.persistence.PersistenceManager;
import com.routemq.persistence.StorageEngine;
import com.routemq.persistence.StorageOperation;
import com.routemq.persistence.StorageVisitor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Virtual Host Concurrency Tests")
class VirtualHostConcurrencyTest {

    private GatedStorageEngine storage;
    private VirtualHost vhost;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        storage = new GatedStorageEngine();
        vhost = new VirtualHost("/", new PersistenceManager(storage, "/"));
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        storage.release();
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Delete waits for a bind in progress and removes its persisted binding")
    void testDeleteDuringBind() throws Exception {
        vhost.declareExchange("x", ExchangeType.DIRECT, true, false, false, false, null);
        storage.holdNextBindingWrite();

        Future<Boolean> bind = executor.submit(() -> vhost.bindQueue("x", "q", "rk", null));
        assertThat(storage.awaitHeldWrite()).isTrue();

        Future<Boolean> delete = executor.submit(() -> vhost.deleteExchange("x", false));
        assertThatThrownBy(() -> delete.get(200, TimeUnit.MILLISECONDS))
            .isInstanceOf(TimeoutException.class);

        storage.release();
        assertThat(bind.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(delete.get(5, TimeUnit.SECONDS)).isTrue();

        assertThat(storage.keys()).noneMatch(key -> key.startsWith("binding:"));

        vhost.declareExchange("x", ExchangeType.DIRECT, true, false, false, false, null);
        VirtualHost restarted = new VirtualHost("/", new PersistenceManager(storage, "/"));
        restarted.recover();

        assertThat(restarted.getExchange("x").getBindings()).isEmpty();
        assertThat(restarted.route("x", "rk", null)).isEmpty();
    }

    @Test
    @DisplayName("Bind to an exchange deleted while it waited fails with not found")
    void testBindAfterDelete() throws Exception {
        vhost.declareExchange("x", ExchangeType.DIRECT, true, false, false, false, null);
        storage.holdNextBindingWrite();

        Future<Boolean> first = executor.submit(() -> vhost.bindQueue("x", "q1", "rk", null));
        assertThat(storage.awaitHeldWrite()).isTrue();
        Future<Boolean> delete = executor.submit(() -> vhost.deleteExchange("x", false));

        storage.release();
        assertThat(first.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(delete.get(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> vhost.bindQueue("x", "q2", "rk", null))
            .isInstanceOf(AmqpException.class);
        assertThat(storage.keys()).noneMatch(key -> key.startsWith("binding:"));
    }

    /**
     * In-memory store that can hold the next binding write until released.
     */
    private static class GatedStorageEngine implements StorageEngine {
        private final TreeMap<String, byte[]> records = new TreeMap<>();
        private final AtomicBoolean holdBindingWrite = new AtomicBoolean(false);
        private final CountDownLatch held = new CountDownLatch(1);
        private final CountDownLatch released = new CountDownLatch(1);

        void holdNextBindingWrite() {
            holdBindingWrite.set(true);
        }

        boolean awaitHeldWrite() throws InterruptedException {
            return held.await(5, TimeUnit.SECONDS);
        }

        void release() {
            released.countDown();
        }

        synchronized List<String> keys() {
            return List.copyOf(records.keySet());
        }

        @Override
        public void applyBatch(List<StorageOperation> operations) {
            boolean writesBinding = operations.stream().anyMatch(op ->
                op.getKind() == StorageOperation.Kind.SET && op.getKey().startsWith("binding:"));
            if (writesBinding && holdBindingWrite.compareAndSet(true, false)) {
                held.countDown();
                try {
                    released.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while held", e);
                }
            }
            synchronized (this) {
                for (StorageOperation op : operations) {
                    if (op.getKind() == StorageOperation.Kind.SET) {
                        records.put(op.getKey(), op.getValue());
                    } else {
                        records.remove(op.getKey());
                    }
                }
            }
        }

        @Override
        public synchronized Optional<byte[]> get(String key) {
            return Optional.ofNullable(records.get(key));
        }

        @Override
        public void iterateAll(StorageVisitor visitor) {
            for (Map.Entry<String, byte[]> entry : snapshot().entrySet()) {
                if (!visitor.visit(entry.getKey(), entry.getValue())) {
                    return;
                }
            }
        }

        private synchronized Map<String, byte[]> snapshot() {
            return new TreeMap<>(records);
        }

        @Override
        public void compact() {
        }

        @Override
        public void close() {
        }
    }
}
