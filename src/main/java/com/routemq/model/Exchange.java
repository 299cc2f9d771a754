package com.routemq.model;

import com.routemq.amqp.AmqpCodec;
import com.routemq.exchange.BindingMatcher;
import com.routemq.exchange.TopicMatcher;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One exchange: its immutable identity and flags plus its ordered binding set.
 * <p>
 * Every read or write of the binding set, routing included, holds the same monitor,
 * so routing never observes a set in the middle of an update.
 */
public class Exchange {
    private final String name;
    private final byte typeId;
    private final boolean durable;
    private final boolean autoDelete;
    private final boolean internal;
    private final boolean system;
    private final Map<String, Object> arguments;
    private final List<Binding> bindings = new ArrayList<>();

    public Exchange(String name, ExchangeType type, boolean durable, boolean autoDelete,
                    boolean internal, boolean system) {
        this(name, type, durable, autoDelete, internal, system, null);
    }

    public Exchange(String name, ExchangeType type, boolean durable, boolean autoDelete,
                    boolean internal, boolean system, Map<String, Object> arguments) {
        this(name, type.getId(), durable, autoDelete, internal, system, arguments);
    }

    private Exchange(String name, byte typeId, boolean durable, boolean autoDelete,
                     boolean internal, boolean system, Map<String, Object> arguments) {
        this.name = name;
        this.typeId = typeId;
        this.durable = durable;
        this.autoDelete = autoDelete;
        this.internal = internal;
        this.system = system;
        this.arguments = arguments != null ? new HashMap<>(arguments) : new HashMap<>();
    }

    public String getName() {
        return name;
    }

    /**
     * @return the exchange type, or {@code null} if the exchange was restored with an unknown type id
     */
    public ExchangeType getType() {
        return ExchangeType.fromId(typeId);
    }

    public byte getTypeId() {
        return typeId;
    }

    public boolean isDurable() {
        return durable;
    }

    public boolean isAutoDelete() {
        return autoDelete;
    }

    public boolean isInternal() {
        return internal;
    }

    public boolean isSystem() {
        return system;
    }

    public Map<String, Object> getArguments() {
        return Collections.unmodifiableMap(arguments);
    }

    /**
     * Append a binding unless an equal one is already present.
     *
     * @return true if the binding was added
     */
    public boolean addBinding(Binding binding) {
        synchronized (bindings) {
            if (bindings.contains(binding)) {
                return false;
            }
            return bindings.add(binding);
        }
    }

    /**
     * Remove the first binding equal to the given one.
     *
     * @return true if a binding was removed
     */
    public boolean removeBinding(Binding binding) {
        synchronized (bindings) {
            return bindings.remove(binding);
        }
    }

    /**
     * Remove all bindings to a queue (used when deleting a queue).
     *
     * @return the removed bindings in insertion order
     */
    public List<Binding> removeBindingsForQueue(String queueName) {
        List<Binding> kept = new ArrayList<>();
        List<Binding> removed = new ArrayList<>();
        synchronized (bindings) {
            for (Binding binding : bindings) {
                if (binding.getQueue().equals(queueName)) {
                    removed.add(binding);
                } else {
                    kept.add(binding);
                }
            }
            bindings.clear();
            bindings.addAll(kept);
        }
        return removed;
    }

    public List<Binding> getBindings() {
        synchronized (bindings) {
            return new ArrayList<>(bindings);
        }
    }

    public int getBindingCount() {
        synchronized (bindings) {
            return bindings.size();
        }
    }

    /**
     * Names of the queues a message should be delivered to, in binding order.
     * An exchange with an unknown type routes nowhere.
     */
    public Set<String> matchedQueues(RoutingContext context) {
        Set<String> matched = new LinkedHashSet<>();
        ExchangeType type = getType();
        if (type == null) {
            return matched;
        }

        synchronized (bindings) {
            switch (type) {
                case DIRECT:
                    // Single target: the oldest matching binding wins
                    for (Binding binding : bindings) {
                        if (BindingMatcher.matchesDirect(binding, context)) {
                            matched.add(binding.getQueue());
                            break;
                        }
                    }
                    break;
                case FANOUT:
                    for (Binding binding : bindings) {
                        if (BindingMatcher.matchesFanout(binding, context)) {
                            matched.add(binding.getQueue());
                        }
                    }
                    break;
                case TOPIC:
                    List<String> keyWords = TopicMatcher.split(context.getRoutingKey());
                    for (Binding binding : bindings) {
                        if (BindingMatcher.matchesTopic(binding, context, keyWords)) {
                            matched.add(binding.getQueue());
                        }
                    }
                    break;
                case HEADERS:
                    for (Binding binding : bindings) {
                        if (BindingMatcher.matchesHeaders(binding, context)) {
                            matched.add(binding.getQueue());
                        }
                    }
                    break;
                default:
                    break;
            }
        }
        return matched;
    }

    /**
     * Compare the attributes a redeclare must not change.
     *
     * @param other the exchange as requested by the redeclare
     * @return the first differing attribute, or empty if the two are equivalent
     */
    public Optional<ExchangeConflict> equalWithConflict(Exchange other) {
        if (typeId != other.typeId) {
            return Optional.of(new ExchangeConflict(name, "type", typeAlias(other.typeId), typeAlias(typeId)));
        }
        if (durable != other.durable) {
            return Optional.of(new ExchangeConflict(name, "durable", other.durable, durable));
        }
        if (autoDelete != other.autoDelete) {
            return Optional.of(new ExchangeConflict(name, "autoDelete", other.autoDelete, autoDelete));
        }
        if (internal != other.internal) {
            return Optional.of(new ExchangeConflict(name, "internal", other.internal, internal));
        }
        return Optional.empty();
    }

    private static String typeAlias(byte id) {
        ExchangeType type = ExchangeType.fromId(id);
        return type != null ? type.getAlias() : Byte.toString(id);
    }

    /**
     * Storage record: name as a short string followed by the type id byte.
     * Flags and arguments are not part of the record.
     */
    public byte[] marshal() {
        ByteBuf buf = Unpooled.buffer();
        AmqpCodec.encodeShortString(buf, name);
        buf.writeByte(typeId);
        return AmqpCodec.toByteArray(buf);
    }

    /**
     * Rebuild an exchange from its storage record. Only durable exchanges are stored,
     * so the result is always durable; the remaining flags take their defaults.
     */
    public static Exchange unmarshal(byte[] data) {
        ByteBuf buf = Unpooled.wrappedBuffer(data);
        try {
            String name = AmqpCodec.decodeShortString(buf);
            byte typeId = buf.readByte();
            return new Exchange(name, typeId, true, false, false, false, null);
        } finally {
            buf.release();
        }
    }

    @Override
    public String toString() {
        return String.format("Exchange{name='%s', type=%s, durable=%s, autoDelete=%s, internal=%s, system=%s}",
                name, typeAlias(typeId), durable, autoDelete, internal, system);
    }
}
