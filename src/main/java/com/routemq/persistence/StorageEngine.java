package com.routemq.persistence;

import java.util.List;
import java.util.Optional;

/**
 * Transactional key/value store for broker metadata.
 * <p>
 * Writes are durable when the call returns. Failures surface as {@link StorageException}.
 */
public interface StorageEngine extends AutoCloseable {

    /**
     * Apply all operations in order as one transaction: afterwards either all of them
     * are visible or none is.
     */
    void applyBatch(List<StorageOperation> operations);

    default void set(String key, byte[] value) {
        applyBatch(List.of(StorageOperation.set(key, value)));
    }

    default void delete(String key) {
        applyBatch(List.of(StorageOperation.delete(key)));
    }

    Optional<byte[]> get(String key);

    /**
     * Visit every record in ascending key order until the visitor returns false.
     */
    void iterateAll(StorageVisitor visitor);

    /**
     * Reclaim space in the backing store. Safe to run alongside reads and writes.
     */
    void compact();

    /**
     * Release the store. Calling it again has no effect.
     */
    @Override
    void close();
}
