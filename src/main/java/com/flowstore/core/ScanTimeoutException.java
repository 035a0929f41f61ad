package com.flowstore.core;

import java.time.Duration;

/**
 * Thrown when a key scan or query runs past the caller's timeout.
 */
public class ScanTimeoutException extends StorageException {

    private final Duration timeout;
    private final int examined;

    public ScanTimeoutException(String operation, Duration timeout, int examined) {
        super(String.format("%s exceeded timeout of %dms after examining %d keys",
            operation, timeout.toMillis(), examined));
        this.timeout = timeout;
        this.examined = examined;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public int getExamined() {
        return examined;
    }
}
