package com.routemq.model;

import com.routemq.exchange.HeadersMatcher;
import com.routemq.exchange.TopicMatcher;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A rule linking an exchange to a queue. Two bindings are equal when source exchange,
 * routing key, queue and arguments are all equal.
 */
public class Binding {
    private final String exchange;
    private final String routingKey;
    private final String queue;
    private final Map<String, Object> arguments;

    // Parsed once; bindings are matched on every publish
    private final List<String> patternWords;
    private final HeadersMatcher headersMatcher;

    public Binding(String exchange, String routingKey, String queue) {
        this(exchange, routingKey, queue, null);
    }

    public Binding(String exchange, String routingKey, String queue, Map<String, Object> arguments) {
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.routingKey = routingKey != null ? routingKey : "";
        this.queue = Objects.requireNonNull(queue, "queue");
        this.arguments = arguments != null && !arguments.isEmpty()
            ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
            : Collections.emptyMap();
        this.patternWords = TopicMatcher.split(this.routingKey);
        this.headersMatcher = HeadersMatcher.fromArguments(this.arguments);
    }

    public String getExchange() {
        return exchange;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    public String getQueue() {
        return queue;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    public List<String> getPatternWords() {
        return patternWords;
    }

    public HeadersMatcher getHeadersMatcher() {
        return headersMatcher;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Binding that = (Binding) o;
        return exchange.equals(that.exchange) &&
               routingKey.equals(that.routingKey) &&
               queue.equals(that.queue) &&
               arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(exchange, routingKey, queue, arguments);
    }

    @Override
    public String toString() {
        return String.format("Binding{exchange='%s', routingKey='%s', queue='%s', arguments=%s}",
                exchange, routingKey, queue, arguments);
    }
}
