package com.routemq.server;

import com.routemq.amqp.AmqpConstants;
import com.routemq.amqp.AmqpException;
import com.routemq.model.Binding;
import com.routemq.model.Exchange;
import com.routemq.model.ExchangeType;
import com.routemq.persistence.PersistenceManager;
import com.routemq.persistence.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Entry point for the protocol layer: owns the virtual hosts and the metadata
 * store, applies the exchange.declare rules and maps failures to AMQP reply codes.
 */
public class RoutingBroker {
    private static final Logger logger = LoggerFactory.getLogger(RoutingBroker.class);

    private final StorageEngine storage;
    private final ConcurrentMap<String, VirtualHost> virtualHosts = new ConcurrentHashMap<>();
    private volatile boolean running;

    public RoutingBroker(StorageEngine storage) {
        this(storage, List.of(AmqpConstants.DEFAULT_VIRTUAL_HOST));
    }

    public RoutingBroker(StorageEngine storage, Collection<String> virtualHostNames) {
        this.storage = storage;
        for (String vhostName : virtualHostNames) {
            addVirtualHost(vhostName);
        }
        logger.info("Routing broker initialized with virtual hosts: {}", virtualHosts.keySet());
    }

    public VirtualHost addVirtualHost(String vhostName) {
        return virtualHosts.computeIfAbsent(vhostName,
            n -> new VirtualHost(n, new PersistenceManager(storage, n)));
    }

    /**
     * Drop a virtual host and its in-memory topology. Persisted records are kept.
     */
    public VirtualHost removeVirtualHost(String vhostName) {
        VirtualHost removed = virtualHosts.remove(vhostName);
        if (removed != null) {
            logger.info("Removed virtual host: {}", vhostName);
        }
        return removed;
    }

    public VirtualHost getVirtualHost(String vhostName) {
        return virtualHosts.get(vhostName);
    }

    /**
     * Handle exchange.declare.
     *
     * @return the declared or existing exchange, or {@code null} for a passive declare with no-wait set
     * @throws AmqpException NOT_IMPLEMENTED for an unknown type, COMMAND_INVALID for an empty name,
     *         NOT_FOUND for a passive declare of a missing exchange, ACCESS_REFUSED for a reserved
     *         name and PRECONDITION_FAILED when the exchange exists with other attributes
     */
    public Exchange declareExchange(String vhostName, String name, String typeAlias, boolean passive,
                                    boolean durable, boolean autoDelete, boolean internal, boolean noWait,
                                    Map<String, Object> arguments) {
        VirtualHost vhost = requireVirtualHost(vhostName);

        ExchangeType type = ExchangeType.fromAlias(typeAlias);
        if (type == null) {
            throw AmqpException.notImplemented("exchange type '" + typeAlias + "' not implemented",
                AmqpConstants.CLASS_EXCHANGE, AmqpConstants.METHOD_EXCHANGE_DECLARE);
        }

        if (name == null || name.isEmpty()) {
            throw AmqpException.commandInvalid("exchange name is required",
                AmqpConstants.CLASS_EXCHANGE, AmqpConstants.METHOD_EXCHANGE_DECLARE);
        }

        if (passive) {
            if (noWait) {
                return null;
            }
            Exchange existing = vhost.getExchange(name);
            if (existing == null) {
                throw AmqpException.notFound("no exchange '" + name + "' in vhost '" + vhostName + "'",
                    AmqpConstants.CLASS_EXCHANGE, AmqpConstants.METHOD_EXCHANGE_DECLARE);
            }
            return existing;
        }

        if (name.startsWith(AmqpConstants.RESERVED_EXCHANGE_PREFIX)) {
            throw AmqpException.accessRefused("exchange name '" + name + "' contains reserved prefix '"
                    + AmqpConstants.RESERVED_EXCHANGE_PREFIX + "'",
                AmqpConstants.CLASS_EXCHANGE, AmqpConstants.METHOD_EXCHANGE_DECLARE);
        }

        DeclareResult result = vhost.declareExchange(name, type, durable, autoDelete, internal, false, arguments);
        if (result.isConflict()) {
            throw AmqpException.preconditionFailed(result.getConflict().get().getMessage(),
                AmqpConstants.CLASS_EXCHANGE, AmqpConstants.METHOD_EXCHANGE_DECLARE);
        }
        return result.getExchange();
    }

    /**
     * Handle exchange.delete.
     *
     * @throws AmqpException NOT_FOUND if the exchange does not exist
     */
    public void deleteExchange(String vhostName, String name, boolean ifUnused) {
        VirtualHost vhost = requireVirtualHost(vhostName);
        if (!vhost.deleteExchange(name, ifUnused)) {
            throw AmqpException.notFound("no exchange '" + name + "' in vhost '" + vhostName + "'",
                AmqpConstants.CLASS_EXCHANGE, AmqpConstants.METHOD_EXCHANGE_DELETE);
        }
    }

    public boolean bindQueue(String vhostName, String queueName, String exchangeName, String routingKey,
                             Map<String, Object> arguments) {
        return requireVirtualHost(vhostName).bindQueue(exchangeName, queueName, routingKey, arguments);
    }

    public boolean unbindQueue(String vhostName, String queueName, String exchangeName, String routingKey,
                               Map<String, Object> arguments) {
        return requireVirtualHost(vhostName).unbindQueue(exchangeName, queueName, routingKey, arguments);
    }

    /**
     * Clean up the routing side of queue.delete.
     *
     * @return the bindings that targeted the queue
     */
    public List<Binding> deleteQueue(String vhostName, String queueName) {
        List<Binding> removed = requireVirtualHost(vhostName).removeBindingsForQueue(queueName);
        logger.info("Deleted queue {} with {} bindings on vhost {}", queueName, removed.size(), vhostName);
        return removed;
    }

    /**
     * @return the queues a message published to the exchange goes to; empty if the
     *         virtual host or the exchange does not exist
     */
    public Set<String> route(String vhostName, String exchangeName, String routingKey,
                             Map<String, Object> headers) {
        VirtualHost vhost = virtualHosts.get(vhostName);
        if (vhost == null) {
            logger.warn("Virtual host not found: {}", vhostName);
            return Collections.emptySet();
        }
        Set<String> queues = vhost.route(exchangeName, routingKey, headers);
        logger.debug("Routed message to {} queues via exchange {} on vhost {}", queues.size(), exchangeName, vhostName);
        return queues;
    }

    /**
     * Recover the durable topology of every virtual host. Must complete before the
     * protocol layer accepts connections.
     */
    public void start() {
        logger.info("Starting recovery of durable topology...");
        for (VirtualHost vhost : virtualHosts.values()) {
            logger.info("Recovering topology for vhost: {}", vhost.getName());
            vhost.recover();
        }
        running = true;
        logger.info("Routing broker started");
    }

    /**
     * Close the metadata store. The broker cannot be restarted afterwards.
     */
    public void stop() {
        running = false;
        storage.close();
        logger.info("Routing broker stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public StorageEngine getStorage() {
        return storage;
    }

    private VirtualHost requireVirtualHost(String vhostName) {
        VirtualHost vhost = virtualHosts.get(vhostName);
        if (vhost == null) {
            throw new IllegalArgumentException("Virtual host not found: " + vhostName);
        }
        return vhost;
    }
}
