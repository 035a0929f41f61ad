package com.flowstore.core;

/**
 * Thrown for failures that may succeed when the operation is repeated,
 * such as a backing store that is temporarily unavailable.
 */
public class TransientStorageException extends StorageException {

    public TransientStorageException(String message) {
        super(message);
    }

    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public TransientStorageException(String message, String key, Throwable cause) {
        super(message, key, cause);
    }
}
