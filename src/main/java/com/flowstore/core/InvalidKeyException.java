package com.flowstore.core;

/**
 * Thrown when a key is null, empty, or longer than the configured maximum.
 * Never retried.
 */
public class InvalidKeyException extends StorageException {

    public InvalidKeyException(String message, String key) {
        super(message, key);
    }
}
