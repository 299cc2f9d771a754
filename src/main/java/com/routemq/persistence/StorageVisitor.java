package com.routemq.persistence;

/**
 * Callback for {@link StorageEngine#iterateAll}.
 */
@FunctionalInterface
public interface StorageVisitor {

    /**
     * @return false to stop the iteration
     */
    boolean visit(String key, byte[] value);
}
