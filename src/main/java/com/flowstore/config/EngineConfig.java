package com.flowstore.config;

import com.flowstore.resource.EnvironmentProbe;

import java.time.Clock;
import java.util.Objects;

/**
 * Configuration for a FlowStore engine.
 *
 * The encryption key and memory limit default from the environment
 * ({@code FLOWSTORE_ENCRYPTION_KEY}, {@code FLOWSTORE_MAX_MEMORY_SIZE}) and then from
 * system properties ({@code flowstore.encryption.key}, {@code flowstore.max.memory.size}).
 */
public class EngineConfig {

    public static final long DEFAULT_MAX_MEMORY_SIZE = 100L * 1024 * 1024;

    private long maxMemorySize = DEFAULT_MAX_MEMORY_SIZE;
    private boolean compressionEnabled = true;
    private boolean encryptionEnabled = true;
    private boolean transactionSupport = true;
    private int retryAttempts = 5;
    private long retryDelayMs = 100;
    private String encryptionKey = null;
    private int maxKeyLength = 250;
    private int compressionThreshold = 100;
    private boolean cacheEnabled = true;
    private boolean indexingEnabled = true;
    private long walRetentionMs = 5 * 60 * 1000L;
    private int walMaxEntries = 10_000;
    private int errorLogCapacity = 1000;
    private long maintenanceIntervalMs = 60_000;
    private long healthCheckIntervalMs = 30_000;
    private Clock clock = Clock.systemUTC();
    private EnvironmentProbe environmentProbe = EnvironmentProbe.healthy();

    public EngineConfig() {
        String key = readSetting("FLOWSTORE_ENCRYPTION_KEY", "flowstore.encryption.key");
        if (key != null) {
            this.encryptionKey = key;
        }
        String memory = readSetting("FLOWSTORE_MAX_MEMORY_SIZE", "flowstore.max.memory.size");
        if (memory != null) {
            try {
                setMaxMemorySize(Long.parseLong(memory.trim()));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid max memory size setting: " + memory, e);
            }
        }
    }

    private static String readSetting(String envName, String propertyName) {
        String value = System.getenv(envName);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(propertyName);
        }
        return value == null || value.isEmpty() ? null : value;
    }

    /**
     * Create a config builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    public long getMaxMemorySize() {
        return maxMemorySize;
    }

    public void setMaxMemorySize(long maxMemorySize) {
        if (maxMemorySize <= 0) {
            throw new IllegalArgumentException("maxMemorySize must be positive, got: " + maxMemorySize);
        }
        this.maxMemorySize = maxMemorySize;
    }

    public boolean isCompressionEnabled() {
        return compressionEnabled;
    }

    public void setCompressionEnabled(boolean compressionEnabled) {
        this.compressionEnabled = compressionEnabled;
    }

    public boolean isEncryptionEnabled() {
        return encryptionEnabled;
    }

    public void setEncryptionEnabled(boolean encryptionEnabled) {
        this.encryptionEnabled = encryptionEnabled;
    }

    /**
     * Whether mutations are recorded in the write-ahead log.
     */
    public boolean isTransactionSupport() {
        return transactionSupport;
    }

    public void setTransactionSupport(boolean transactionSupport) {
        this.transactionSupport = transactionSupport;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public void setRetryAttempts(int retryAttempts) {
        if (retryAttempts < 1) {
            throw new IllegalArgumentException("retryAttempts must be at least 1, got: " + retryAttempts);
        }
        this.retryAttempts = retryAttempts;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    public void setRetryDelayMs(long retryDelayMs) {
        if (retryDelayMs < 0) {
            throw new IllegalArgumentException("retryDelayMs must be non-negative, got: " + retryDelayMs);
        }
        this.retryDelayMs = retryDelayMs;
    }

    /**
     * @return the master encryption key, or null if the engine should generate one
     */
    public String getEncryptionKey() {
        return encryptionKey;
    }

    public void setEncryptionKey(String encryptionKey) {
        if (encryptionKey != null && encryptionKey.isEmpty()) {
            throw new IllegalArgumentException("encryptionKey cannot be empty");
        }
        this.encryptionKey = encryptionKey;
    }

    public int getMaxKeyLength() {
        return maxKeyLength;
    }

    public void setMaxKeyLength(int maxKeyLength) {
        if (maxKeyLength <= 0) {
            throw new IllegalArgumentException("maxKeyLength must be positive, got: " + maxKeyLength);
        }
        this.maxKeyLength = maxKeyLength;
    }

    public int getCompressionThreshold() {
        return compressionThreshold;
    }

    public void setCompressionThreshold(int compressionThreshold) {
        if (compressionThreshold < 0) {
            throw new IllegalArgumentException("compressionThreshold must be non-negative, got: " + compressionThreshold);
        }
        this.compressionThreshold = compressionThreshold;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public void setCacheEnabled(boolean cacheEnabled) {
        this.cacheEnabled = cacheEnabled;
    }

    public boolean isIndexingEnabled() {
        return indexingEnabled;
    }

    public void setIndexingEnabled(boolean indexingEnabled) {
        this.indexingEnabled = indexingEnabled;
    }

    public long getWalRetentionMs() {
        return walRetentionMs;
    }

    public void setWalRetentionMs(long walRetentionMs) {
        if (walRetentionMs <= 0) {
            throw new IllegalArgumentException("walRetentionMs must be positive, got: " + walRetentionMs);
        }
        this.walRetentionMs = walRetentionMs;
    }

    public int getWalMaxEntries() {
        return walMaxEntries;
    }

    public void setWalMaxEntries(int walMaxEntries) {
        if (walMaxEntries < 2) {
            throw new IllegalArgumentException("walMaxEntries must be at least 2, got: " + walMaxEntries);
        }
        this.walMaxEntries = walMaxEntries;
    }

    public int getErrorLogCapacity() {
        return errorLogCapacity;
    }

    public void setErrorLogCapacity(int errorLogCapacity) {
        if (errorLogCapacity < 2) {
            throw new IllegalArgumentException("errorLogCapacity must be at least 2, got: " + errorLogCapacity);
        }
        this.errorLogCapacity = errorLogCapacity;
    }

    public long getMaintenanceIntervalMs() {
        return maintenanceIntervalMs;
    }

    public void setMaintenanceIntervalMs(long maintenanceIntervalMs) {
        if (maintenanceIntervalMs <= 0) {
            throw new IllegalArgumentException("maintenanceIntervalMs must be positive, got: " + maintenanceIntervalMs);
        }
        this.maintenanceIntervalMs = maintenanceIntervalMs;
    }

    public long getHealthCheckIntervalMs() {
        return healthCheckIntervalMs;
    }

    public void setHealthCheckIntervalMs(long healthCheckIntervalMs) {
        if (healthCheckIntervalMs <= 0) {
            throw new IllegalArgumentException("healthCheckIntervalMs must be positive, got: " + healthCheckIntervalMs);
        }
        this.healthCheckIntervalMs = healthCheckIntervalMs;
    }

    public Clock getClock() {
        return clock;
    }

    public void setClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public EnvironmentProbe getEnvironmentProbe() {
        return environmentProbe;
    }

    public void setEnvironmentProbe(EnvironmentProbe environmentProbe) {
        this.environmentProbe = Objects.requireNonNull(environmentProbe, "environmentProbe");
    }

    /**
     * Builder for EngineConfig.
     */
    public static class Builder {
        private final EngineConfig config = new EngineConfig();

        public Builder maxMemorySize(long bytes) {
            config.setMaxMemorySize(bytes);
            return this;
        }

        public Builder compressionEnabled(boolean enabled) {
            config.setCompressionEnabled(enabled);
            return this;
        }

        public Builder encryptionEnabled(boolean enabled) {
            config.setEncryptionEnabled(enabled);
            return this;
        }

        public Builder transactionSupport(boolean enabled) {
            config.setTransactionSupport(enabled);
            return this;
        }

        public Builder retryAttempts(int attempts) {
            config.setRetryAttempts(attempts);
            return this;
        }

        public Builder retryDelayMs(long delay) {
            config.setRetryDelayMs(delay);
            return this;
        }

        public Builder encryptionKey(String key) {
            config.setEncryptionKey(key);
            return this;
        }

        public Builder maxKeyLength(int length) {
            config.setMaxKeyLength(length);
            return this;
        }

        public Builder compressionThreshold(int bytes) {
            config.setCompressionThreshold(bytes);
            return this;
        }

        public Builder cacheEnabled(boolean enabled) {
            config.setCacheEnabled(enabled);
            return this;
        }

        public Builder indexingEnabled(boolean enabled) {
            config.setIndexingEnabled(enabled);
            return this;
        }

        public Builder walRetentionMs(long retention) {
            config.setWalRetentionMs(retention);
            return this;
        }

        public Builder walMaxEntries(int max) {
            config.setWalMaxEntries(max);
            return this;
        }

        public Builder errorLogCapacity(int capacity) {
            config.setErrorLogCapacity(capacity);
            return this;
        }

        public Builder maintenanceIntervalMs(long interval) {
            config.setMaintenanceIntervalMs(interval);
            return this;
        }

        public Builder healthCheckIntervalMs(long interval) {
            config.setHealthCheckIntervalMs(interval);
            return this;
        }

        public Builder clock(Clock clock) {
            config.setClock(clock);
            return this;
        }

        public Builder environmentProbe(EnvironmentProbe probe) {
            config.setEnvironmentProbe(probe);
            return this;
        }

        public EngineConfig build() {
            return config;
        }
    }
}
