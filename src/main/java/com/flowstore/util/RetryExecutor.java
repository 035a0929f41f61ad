package com.flowstore.util;

import com.flowstore.codec.CorruptRecordException;
import com.flowstore.core.InvalidKeyException;
import com.flowstore.core.ScanTimeoutException;
import com.flowstore.core.TransientStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Runs an operation with bounded retries and exponential backoff.
 * The delay before retry n (0-based) is {@code baseDelayMs * 2^n}; the calling
 * thread sleeps through it.
 */
public class RetryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    private final int maxAttempts;
    private final long baseDelayMs;
    private final MetricsCollector metrics;

    /**
     * @param maxAttempts total attempts, including the first
     * @param baseDelayMs delay before the first retry
     * @param metrics     metrics to count retries in, may be null
     */
    public RetryExecutor(int maxAttempts, long baseDelayMs, MetricsCollector metrics) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got: " + maxAttempts);
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must be non-negative, got: " + baseDelayMs);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelayMs;
        this.metrics = metrics;
    }

    /**
     * Run an operation, retrying retryable failures.
     *
     * @param operationName name used in log messages
     * @param operation     the operation
     * @return the operation's result
     * @throws RuntimeException the last failure, unchanged if unchecked; checked
     *                          failures are wrapped in {@link TransientStorageException}
     */
    public <T> T execute(String operationName, Callable<T> operation) {
        Exception lastException = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                return operation.call();
            } catch (Exception e) {
                lastException = e;
                if (!isRetryable(e)) {
                    throw propagate(operationName, e);
                }
                if (attempt < maxAttempts - 1) {
                    long delay = delayFor(attempt);
                    logger.warn("{} failed (attempt {}/{}), retrying in {}ms: {}",
                        operationName, attempt + 1, maxAttempts, delay, e.getMessage());
                    if (metrics != null) {
                        metrics.recordRetry();
                    }
                    try {
                        Thread.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new TransientStorageException("Interrupted during retry of " + operationName, ie);
                    }
                } else {
                    logger.warn("{} failed (attempt {}/{}): {}",
                        operationName, attempt + 1, maxAttempts, e.getMessage());
                }
            }
        }

        throw propagate(operationName, lastException);
    }

    /**
     * Backoff before the retry that follows the given 0-based attempt.
     */
    long delayFor(int attempt) {
        return baseDelayMs * (1L << Math.min(attempt, 30));
    }

    /**
     * Failures that cannot succeed on repetition: bad input, undecodable data,
     * and scans that ran out of the caller's time budget.
     */
    static boolean isRetryable(Exception e) {
        return !(e instanceof InvalidKeyException
            || e instanceof CorruptRecordException
            || e instanceof ScanTimeoutException
            || e instanceof IllegalArgumentException);
    }

    private static RuntimeException propagate(String operationName, Exception e) {
        if (e instanceof RuntimeException) {
            return (RuntimeException) e;
        }
        return new TransientStorageException(operationName + " failed", e);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }
}
