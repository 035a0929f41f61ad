package com.flowstore.model;

import java.time.Duration;

/**
 * Pagination and time limit for {@code keys} and {@code query}.
 */
public final class ScanOptions {

    private static final ScanOptions DEFAULTS = new ScanOptions(Integer.MAX_VALUE, 0, null);

    private final int limit;
    private final int offset;
    private final Duration timeout;

    private ScanOptions(int limit, int offset, Duration timeout) {
        this.limit = limit;
        this.offset = offset;
        this.timeout = timeout;
    }

    public static ScanOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getLimit() {
        return limit;
    }

    public int getOffset() {
        return offset;
    }

    /**
     * @return the time limit, or null for none
     */
    public Duration getTimeout() {
        return timeout;
    }

    public static class Builder {
        private int limit = Integer.MAX_VALUE;
        private int offset = 0;
        private Duration timeout;

        public Builder limit(int limit) {
            if (limit < 0) {
                throw new IllegalArgumentException("limit must be non-negative, got: " + limit);
            }
            this.limit = limit;
            return this;
        }

        public Builder offset(int offset) {
            if (offset < 0) {
                throw new IllegalArgumentException("offset must be non-negative, got: " + offset);
            }
            this.offset = offset;
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        public ScanOptions build() {
            return new ScanOptions(limit, offset, timeout);
        }
    }
}
