package com.flowstore.model;

import java.time.Duration;

/**
 * Per-write options. By default values are compressed and encrypted when the
 * engine has those features enabled, no backup is taken, and the value never expires.
 */
public final class SetOptions {

    private static final SetOptions DEFAULTS = new SetOptions(true, true, false, null);

    private final boolean compress;
    private final boolean encrypt;
    private final boolean backup;
    private final Duration ttl;

    private SetOptions(boolean compress, boolean encrypt, boolean backup, Duration ttl) {
        this.compress = compress;
        this.encrypt = encrypt;
        this.backup = backup;
        this.ttl = ttl;
    }

    public static SetOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isCompress() {
        return compress;
    }

    public boolean isEncrypt() {
        return encrypt;
    }

    public boolean isBackup() {
        return backup;
    }

    /**
     * Time to live of the written value, or null if it never expires.
     */
    public Duration getTtl() {
        return ttl;
    }

    @Override
    public String toString() {
        return "SetOptions{compress=" + compress + ", encrypt=" + encrypt + ", backup=" + backup + ", ttl=" + ttl + '}';
    }

    public static class Builder {
        private boolean compress = true;
        private boolean encrypt = true;
        private boolean backup = false;
        private Duration ttl;

        public Builder compress(boolean compress) {
            this.compress = compress;
            return this;
        }

        public Builder encrypt(boolean encrypt) {
            this.encrypt = encrypt;
            return this;
        }

        public Builder backup(boolean backup) {
            this.backup = backup;
            return this;
        }

        /**
         * Expire the value this long after the write. Null clears the TTL.
         *
         * @throws IllegalArgumentException if the duration is zero or negative
         */
        public Builder ttl(Duration ttl) {
            if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
                throw new IllegalArgumentException("ttl must be positive, got: " + ttl);
            }
            this.ttl = ttl;
            return this;
        }

        public SetOptions build() {
            return new SetOptions(compress, encrypt, backup, ttl);
        }
    }
}
