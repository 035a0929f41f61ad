package com.flowstore.codec;

import com.flowstore.core.StorageException;

/**
 * Thrown when a stored payload cannot be turned back into a value.
 * Never retried: the stored bytes will not change between attempts.
 */
public class CorruptRecordException extends StorageException {

    public CorruptRecordException(String message) {
        super(message);
    }

    public CorruptRecordException(String message, Throwable cause) {
        super(message, cause);
    }

    public CorruptRecordException(String message, String key, Throwable cause) {
        super(message, key, cause);
    }
}
