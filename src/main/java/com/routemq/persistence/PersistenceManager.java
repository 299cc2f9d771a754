package com.routemq.persistence;

import com.routemq.amqp.AmqpCodec;
import com.routemq.model.Binding;
import com.routemq.model.Exchange;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Stores the durable topology of one virtual host as key/value records.
 * <p>
 * Exchange records live under {@code exchange:<len>:<vhost>:<name>} and hold
 * {@link Exchange#marshal()}. Binding records live under
 * {@code binding:<len>:<vhost>:<uuid>} where the uuid is derived from the record
 * itself, so saving an equal binding twice writes the same key.
 */
public class PersistenceManager {
    private static final Logger logger = LoggerFactory.getLogger(PersistenceManager.class);

    static final String EXCHANGE_PREFIX = "exchange:";
    static final String BINDING_PREFIX = "binding:";

    private final StorageEngine storage;
    private final String vhost;
    private final String exchangeKeyPrefix;
    private final String bindingKeyPrefix;

    public PersistenceManager(StorageEngine storage, String vhost) {
        this.storage = storage;
        this.vhost = vhost;
        // The length prefix keeps "/a" + ":b" and "/a:b" apart
        String scope = vhost.length() + ":" + vhost + ":";
        this.exchangeKeyPrefix = EXCHANGE_PREFIX + scope;
        this.bindingKeyPrefix = BINDING_PREFIX + scope;
    }

    public String getVirtualHost() {
        return vhost;
    }

    public void saveExchange(Exchange exchange) {
        storage.set(exchangeKey(exchange.getName()), exchange.marshal());
        logger.debug("Saved exchange: {} in vhost: {}", exchange.getName(), vhost);
    }

    /**
     * Delete an exchange record together with the records of the given bindings, atomically.
     */
    public void deleteExchange(String exchangeName, Collection<Binding> bindings) {
        List<StorageOperation> operations = new ArrayList<>(bindings.size() + 1);
        operations.add(StorageOperation.delete(exchangeKey(exchangeName)));
        for (Binding binding : bindings) {
            operations.add(StorageOperation.delete(bindingKey(binding)));
        }
        storage.applyBatch(operations);
        logger.debug("Deleted exchange: {} with {} bindings in vhost: {}", exchangeName, bindings.size(), vhost);
    }

    public void saveBinding(Binding binding) {
        byte[] record = encodeBinding(binding);
        storage.set(bindingKey(record), record);
        logger.debug("Saved binding: {} -> {} ({}) in vhost: {}",
            binding.getExchange(), binding.getQueue(), binding.getRoutingKey(), vhost);
    }

    public void deleteBinding(Binding binding) {
        storage.delete(bindingKey(binding));
        logger.debug("Deleted binding: {} -> {} ({}) in vhost: {}",
            binding.getExchange(), binding.getQueue(), binding.getRoutingKey(), vhost);
    }

    /**
     * Delete several binding records in one batch. An empty collection writes nothing.
     */
    public void deleteBindings(Collection<Binding> bindings) {
        if (bindings.isEmpty()) {
            return;
        }
        List<StorageOperation> operations = new ArrayList<>(bindings.size());
        for (Binding binding : bindings) {
            operations.add(StorageOperation.delete(bindingKey(binding)));
        }
        storage.applyBatch(operations);
        logger.debug("Deleted {} bindings in vhost: {}", bindings.size(), vhost);
    }

    /**
     * Load every exchange and binding record of this virtual host. Records that
     * cannot be decoded are logged and skipped.
     */
    public Topology loadTopology() {
        List<Exchange> exchanges = new ArrayList<>();
        List<Binding> bindings = new ArrayList<>();

        storage.iterateAll((key, value) -> {
            if (key.startsWith(exchangeKeyPrefix)) {
                try {
                    exchanges.add(Exchange.unmarshal(value));
                } catch (RuntimeException e) {
                    logger.warn("Skipping unreadable exchange record {} in vhost: {}", key, vhost, e);
                }
            } else if (key.startsWith(bindingKeyPrefix)) {
                try {
                    bindings.add(decodeBinding(value));
                } catch (RuntimeException e) {
                    logger.warn("Skipping unreadable binding record {} in vhost: {}", key, vhost, e);
                }
            }
            return true;
        });

        logger.info("Loaded {} exchanges and {} bindings from vhost: {}", exchanges.size(), bindings.size(), vhost);
        return new Topology(exchanges, bindings);
    }

    String exchangeKey(String exchangeName) {
        return exchangeKeyPrefix + exchangeName;
    }

    String bindingKey(Binding binding) {
        return bindingKey(encodeBinding(binding));
    }

    private String bindingKey(byte[] record) {
        return bindingKeyPrefix + UUID.nameUUIDFromBytes(record);
    }

    static byte[] encodeBinding(Binding binding) {
        ByteBuf buf = Unpooled.buffer();
        AmqpCodec.encodeShortString(buf, binding.getExchange());
        AmqpCodec.encodeShortString(buf, binding.getQueue());
        AmqpCodec.encodeShortString(buf, binding.getRoutingKey());
        AmqpCodec.encodeTable(buf, binding.getArguments());
        return AmqpCodec.toByteArray(buf);
    }

    static Binding decodeBinding(byte[] record) {
        ByteBuf buf = Unpooled.wrappedBuffer(record);
        try {
            String exchange = AmqpCodec.decodeShortString(buf);
            String queue = AmqpCodec.decodeShortString(buf);
            String routingKey = AmqpCodec.decodeShortString(buf);
            Map<String, Object> arguments = AmqpCodec.decodeTable(buf);
            return new Binding(exchange, routingKey, queue, arguments);
        } finally {
            buf.release();
        }
    }

    // Recovered topology of one virtual host, in key order
    public static class Topology {
        public final List<Exchange> exchanges;
        public final List<Binding> bindings;

        public Topology(List<Exchange> exchanges, List<Binding> bindings) {
            this.exchanges = exchanges;
            this.bindings = bindings;
        }
    }
}
