package com.routemq.model;

/**
 * The four routing kinds. The id is the byte persisted in exchange records.
 */
public enum ExchangeType {
    DIRECT((byte) 1, "direct"),
    FANOUT((byte) 2, "fanout"),
    TOPIC((byte) 3, "topic"),
    HEADERS((byte) 4, "headers");

    private final byte id;
    private final String alias;

    ExchangeType(byte id, String alias) {
        this.id = id;
        this.alias = alias;
    }

    public byte getId() {
        return id;
    }

    public String getAlias() {
        return alias;
    }

    /**
     * @return the type with the given id, or {@code null} for an unknown id
     */
    public static ExchangeType fromId(byte id) {
        for (ExchangeType type : values()) {
            if (type.id == id) {
                return type;
            }
        }
        return null;
    }

    /**
     * @return the type with the given alias, or {@code null} for an unknown alias
     */
    public static ExchangeType fromAlias(String alias) {
        for (ExchangeType type : values()) {
            if (type.alias.equals(alias)) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return alias;
    }
}
