package com.flowstore.codec;

/**
 * Thrown when ciphertext is malformed, has been tampered with, or was
 * produced under a different key.
 */
public class DecryptionException extends CorruptRecordException {

    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
