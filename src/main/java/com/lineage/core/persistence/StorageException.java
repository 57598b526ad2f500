package com.lineage.core.persistence;

/**
 * Thrown when a store operation fails at the database level.
 * <p>
 * The message is stable per operation (for example "Failed to add message")
 * so callers can classify failures without parsing driver errors; the
 * driver exception is kept as the cause.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
