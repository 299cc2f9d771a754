package com.routemq.persistence;

/**
 * Thrown when the metadata store cannot be opened or a read or write against it fails.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
