package com.routemq.server;

import com.routemq.model.Exchange;
import com.routemq.model.ExchangeConflict;

import java.util.Optional;

/**
 * Outcome of {@link VirtualHost#declareExchange}: a newly created exchange, an
 * existing equivalent one, or a conflict with the existing one.
 */
public final class DeclareResult {
    private final boolean created;
    private final Exchange exchange;
    private final ExchangeConflict conflict;

    private DeclareResult(boolean created, Exchange exchange, ExchangeConflict conflict) {
        this.created = created;
        this.exchange = exchange;
        this.conflict = conflict;
    }

    static DeclareResult created(Exchange exchange) {
        return new DeclareResult(true, exchange, null);
    }

    static DeclareResult existing(Exchange exchange) {
        return new DeclareResult(false, exchange, null);
    }

    static DeclareResult conflict(Exchange exchange, ExchangeConflict conflict) {
        return new DeclareResult(false, exchange, conflict);
    }

    public boolean isCreated() {
        return created;
    }

    /**
     * @return the registered exchange; on conflict, the existing one
     */
    public Exchange getExchange() {
        return exchange;
    }

    public Optional<ExchangeConflict> getConflict() {
        return Optional.ofNullable(conflict);
    }

    public boolean isConflict() {
        return conflict != null;
    }

    @Override
    public String toString() {
        return String.format("DeclareResult{created=%s, exchange='%s', conflict=%s}",
                created, exchange.getName(), conflict);
    }
}
