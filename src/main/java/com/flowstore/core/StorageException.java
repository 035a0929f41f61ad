package com.flowstore.core;

/**
 * Base class for all errors raised by the storage engine.
 */
public class StorageException extends RuntimeException {

    private final String key;

    public StorageException(String message) {
        super(message);
        this.key = null;
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
        this.key = null;
    }

    public StorageException(String message, String key) {
        super(message);
        this.key = key;
    }

    public StorageException(String message, String key, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /**
     * Get the key the failed operation was acting on.
     *
     * @return the key, or null when the error is not tied to a key
     */
    public String getKey() {
        return key;
    }
}
