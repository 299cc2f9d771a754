package com.routemq.model;

import java.util.Objects;

/**
 * First attribute on which a redeclared exchange differs from the existing one.
 */
public class ExchangeConflict {
    private final String exchangeName;
    private final String attribute;
    private final String received;
    private final String current;

    public ExchangeConflict(String exchangeName, String attribute, Object received, Object current) {
        this.exchangeName = exchangeName;
        this.attribute = attribute;
        this.received = String.valueOf(received);
        this.current = String.valueOf(current);
    }

    public String getExchangeName() {
        return exchangeName;
    }

    public String getAttribute() {
        return attribute;
    }

    public String getReceived() {
        return received;
    }

    public String getCurrent() {
        return current;
    }

    public String getMessage() {
        return String.format("inequivalent arg '%s' for exchange '%s': received '%s' but current is '%s'",
                attribute, exchangeName, received, current);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExchangeConflict that = (ExchangeConflict) o;
        return Objects.equals(exchangeName, that.exchangeName) &&
               Objects.equals(attribute, that.attribute) &&
               Objects.equals(received, that.received) &&
               Objects.equals(current, that.current);
    }

    @Override
    public int hashCode() {
        return Objects.hash(exchangeName, attribute, received, current);
    }

    @Override
    public String toString() {
        return getMessage();
    }
}
