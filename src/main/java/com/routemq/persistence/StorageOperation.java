package com.routemq.persistence;

import java.util.Objects;

/**
 * One write inside a storage batch.
 */
public final class StorageOperation {

    public enum Kind {
        SET,
        DELETE
    }

    private final Kind kind;
    private final String key;
    private final byte[] value;

    private StorageOperation(Kind kind, String key, byte[] value) {
        this.kind = kind;
        this.key = Objects.requireNonNull(key, "key");
        this.value = value;
    }

    public static StorageOperation set(String key, byte[] value) {
        return new StorageOperation(Kind.SET, key, Objects.requireNonNull(value, "value"));
    }

    public static StorageOperation delete(String key) {
        return new StorageOperation(Kind.DELETE, key, null);
    }

    public Kind getKind() {
        return kind;
    }

    public String getKey() {
        return key;
    }

    /**
     * @return the value to store, {@code null} for a delete
     */
    public byte[] getValue() {
        return value;
    }

    @Override
    public String toString() {
        return kind == Kind.SET
            ? String.format("StorageOperation{SET '%s' (%d bytes)}", key, value.length)
            : String.format("StorageOperation{DELETE '%s'}", key);
    }
}
