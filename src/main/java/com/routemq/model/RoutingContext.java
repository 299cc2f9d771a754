package com.routemq.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * What routing needs to know about one published message.
 */
public class RoutingContext {
    private final String exchangeName;
    private final String routingKey;
    private final Map<String, Object> headers;

    public RoutingContext(String exchangeName, String routingKey) {
        this(exchangeName, routingKey, null);
    }

    public RoutingContext(String exchangeName, String routingKey, Map<String, Object> headers) {
        this.exchangeName = exchangeName;
        this.routingKey = routingKey != null ? routingKey : "";
        this.headers = headers != null ? Collections.unmodifiableMap(new HashMap<>(headers)) : Collections.emptyMap();
    }

    public String getExchangeName() {
        return exchangeName;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    public Map<String, Object> getHeaders() {
        return headers;
    }

    @Override
    public String toString() {
        return String.format("RoutingContext{exchange='%s', routingKey='%s', headers=%s}",
                exchangeName, routingKey, headers);
    }
}
