package com.routemq.server;

import com.routemq.amqp.AmqpConstants;
import com.routemq.amqp.AmqpException;
import com.routemq.model.Binding;
import com.routemq.model.Exchange;
import com.routemq.model.ExchangeConflict;
import com.routemq.model.ExchangeType;
import com.routemq.model.RoutingContext;
import com.routemq.persistence.PersistenceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Exchange registry of one virtual host.
 * <p>
 * Lookups and routing go straight to the concurrent map. Every change to the
 * topology (declare, delete, bind, unbind, queue cleanup and recovery) is
 * serialized on this object's monitor, which routing never takes. A binding is
 * therefore never persisted for an exchange that is being deleted.
 * Durable changes are written through the host's {@link PersistenceManager}:
 * creations are persisted before they become visible, removals after.
 */
public class VirtualHost {
    private static final Logger logger = LoggerFactory.getLogger(VirtualHost.class);

    private final String name;
    private final ConcurrentMap<String, Exchange> exchanges;
    private final PersistenceManager persistenceManager;

    public VirtualHost(String name, PersistenceManager persistenceManager) {
        this.name = name;
        this.exchanges = new ConcurrentHashMap<>();
        this.persistenceManager = persistenceManager;

        initializeDefaultExchanges();
    }

    private void initializeDefaultExchanges() {
        addSystemExchange(AmqpConstants.DEFAULT_EXCHANGE, ExchangeType.DIRECT);
        addSystemExchange("amq.direct", ExchangeType.DIRECT);
        addSystemExchange("amq.fanout", ExchangeType.FANOUT);
        addSystemExchange("amq.topic", ExchangeType.TOPIC);
        addSystemExchange("amq.headers", ExchangeType.HEADERS);
        addSystemExchange("amq.match", ExchangeType.HEADERS);
    }

    private void addSystemExchange(String exchangeName, ExchangeType type) {
        exchanges.put(exchangeName, new Exchange(exchangeName, type, true, false, false, true));
    }

    public String getName() {
        return name;
    }

    /**
     * Create the exchange if it does not exist, otherwise compare it with the existing one.
     * A conflict is reported in the result and changes nothing.
     *
     * @throws com.routemq.persistence.StorageException if a durable exchange cannot be persisted;
     *         the exchange is then not registered
     */
    public synchronized DeclareResult declareExchange(String exchangeName, ExchangeType type, boolean durable,
                                                      boolean autoDelete, boolean internal, boolean system,
                                                      Map<String, Object> arguments) {
        Exchange requested = new Exchange(exchangeName, type, durable, autoDelete, internal, system, arguments);

        Exchange existing = exchanges.get(exchangeName);
        if (existing != null) {
            Optional<ExchangeConflict> conflict = existing.equalWithConflict(requested);
            if (conflict.isPresent()) {
                logger.debug("Redeclare of exchange {} on vhost {} rejected: {}",
                           exchangeName, name, conflict.get().getMessage());
                return DeclareResult.conflict(existing, conflict.get());
            }
            return DeclareResult.existing(existing);
        }

        if (durable) {
            persistenceManager.saveExchange(requested);
        }
        exchanges.put(exchangeName, requested);

        logger.info("Declared exchange: {} ({}) on vhost: {}", exchangeName, type, name);
        return DeclareResult.created(requested);
    }

    public Exchange getExchange(String exchangeName) {
        return exchanges.get(exchangeName);
    }

    public List<Exchange> getAllExchanges() {
        return new ArrayList<>(exchanges.values());
    }

    public int getExchangeCount() {
        return exchanges.size();
    }

    /**
     * Remove an exchange and all of its bindings.
     *
     * @return false if no exchange with that name exists
     * @throws AmqpException ACCESS_REFUSED for a system exchange, PRECONDITION_FAILED
     *         if {@code ifUnused} is set and the exchange still has bindings
     */
    public synchronized boolean deleteExchange(String exchangeName, boolean ifUnused) {
        Exchange exchange = exchanges.get(exchangeName);
        if (exchange == null) {
            return false;
        }
        if (exchange.isSystem()) {
            throw AmqpException.accessRefused("cannot delete system exchange '" + exchangeName + "'",
                AmqpConstants.CLASS_EXCHANGE, AmqpConstants.METHOD_EXCHANGE_DELETE);
        }
        if (ifUnused && exchange.getBindingCount() > 0) {
            throw AmqpException.preconditionFailed("exchange '" + exchangeName + "' in use",
                AmqpConstants.CLASS_EXCHANGE, AmqpConstants.METHOD_EXCHANGE_DELETE);
        }

        exchanges.remove(exchangeName);
        if (exchange.isDurable()) {
            persistenceManager.deleteExchange(exchangeName, exchange.getBindings());
        }

        logger.info("Deleted exchange: {} on vhost: {}", exchangeName, name);
        return true;
    }

    /**
     * Bind a queue to an exchange. Binding a durable exchange persists the binding first.
     *
     * @return false if an equal binding already existed
     * @throws AmqpException NOT_FOUND if the exchange does not exist
     */
    public synchronized boolean bindQueue(String exchangeName, String queueName, String routingKey,
                                          Map<String, Object> arguments) {
        Exchange exchange = requireExchange(exchangeName, AmqpConstants.METHOD_QUEUE_BIND);
        Binding binding = new Binding(exchangeName, routingKey, queueName, arguments);

        if (exchange.isDurable()) {
            persistenceManager.saveBinding(binding);
        }
        boolean added = exchange.addBinding(binding);

        if (added) {
            logger.info("Bound queue {} to exchange {} with routing key {} on vhost {}",
                       queueName, exchangeName, routingKey, name);
        }
        return added;
    }

    /**
     * @return false if no such binding existed
     * @throws AmqpException NOT_FOUND if the exchange does not exist
     */
    public synchronized boolean unbindQueue(String exchangeName, String queueName, String routingKey,
                                            Map<String, Object> arguments) {
        Exchange exchange = requireExchange(exchangeName, AmqpConstants.METHOD_QUEUE_UNBIND);
        Binding binding = new Binding(exchangeName, routingKey, queueName, arguments);

        boolean removed = exchange.removeBinding(binding);
        if (removed && exchange.isDurable()) {
            persistenceManager.deleteBinding(binding);
        }

        if (removed) {
            logger.info("Unbound queue {} from exchange {} with routing key {} on vhost {}",
                       queueName, exchangeName, routingKey, name);
        }
        return removed;
    }

    /**
     * Drop every binding that targets the queue, on every exchange. Persisted
     * bindings are deleted in one batch.
     *
     * @return the removed bindings
     */
    public synchronized List<Binding> removeBindingsForQueue(String queueName) {
        List<Binding> removed = new ArrayList<>();
        List<Binding> persisted = new ArrayList<>();

        for (Exchange exchange : exchanges.values()) {
            List<Binding> fromExchange = exchange.removeBindingsForQueue(queueName);
            removed.addAll(fromExchange);
            if (exchange.isDurable()) {
                persisted.addAll(fromExchange);
            }
        }
        persistenceManager.deleteBindings(persisted);

        if (!removed.isEmpty()) {
            logger.debug("Removed {} bindings for queue {} on vhost {}", removed.size(), queueName, name);
        }
        return removed;
    }

    /**
     * @return the queues the message goes to; empty if the exchange does not exist
     */
    public Set<String> route(String exchangeName, String routingKey, Map<String, Object> headers) {
        Exchange exchange = exchanges.get(exchangeName);
        if (exchange == null) {
            logger.debug("Exchange not found: {} on vhost {}", exchangeName, name);
            return Collections.emptySet();
        }
        return exchange.matchedQueues(new RoutingContext(exchangeName, routingKey, headers));
    }

    /**
     * Load the persisted exchanges and bindings of this host. Exchanges already
     * registered (the system ones) are kept; bindings whose exchange is missing are skipped.
     */
    public synchronized void recover() {
        PersistenceManager.Topology topology = persistenceManager.loadTopology();

        int recoveredExchanges = 0;
        for (Exchange exchange : topology.exchanges) {
            if (exchanges.putIfAbsent(exchange.getName(), exchange) != null) {
                logger.debug("Exchange {} already exists in vhost {}, skipping recovery",
                           exchange.getName(), name);
                continue;
            }
            recoveredExchanges++;
            logger.debug("Recovered exchange: {} in vhost: {}", exchange.getName(), name);
        }

        int recoveredBindings = 0;
        for (Binding binding : topology.bindings) {
            Exchange exchange = exchanges.get(binding.getExchange());
            if (exchange == null) {
                logger.warn("Cannot recover binding: exchange {} not found in vhost: {}",
                          binding.getExchange(), name);
                continue;
            }
            if (exchange.addBinding(binding)) {
                recoveredBindings++;
            }
        }

        logger.info("Recovery completed for vhost: {} - {} exchanges, {} bindings",
                  name, recoveredExchanges, recoveredBindings);
    }

    private Exchange requireExchange(String exchangeName, short methodId) {
        Exchange exchange = exchanges.get(exchangeName);
        if (exchange == null) {
            throw AmqpException.notFound("no exchange '" + exchangeName + "' in vhost '" + name + "'",
                AmqpConstants.CLASS_QUEUE, methodId);
        }
        return exchange;
    }

    @Override
    public String toString() {
        return String.format("VirtualHost{name='%s', exchanges=%d}", name, exchanges.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VirtualHost that = (VirtualHost) o;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
