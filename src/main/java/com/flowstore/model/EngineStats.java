package com.flowstore.model;

import java.util.List;

/**
 * Point-in-time statistics for an engine, grouped by subsystem.
 */
public final class EngineStats {

    private final Storage storage;
    private final Performance performance;
    private final Cache cache;
    private final Compression compression;
    private final Encryption encryption;
    private final Resources resources;
    private final Health health;
    private final Config config;

    public EngineStats(Storage storage, Performance performance, Cache cache, Compression compression,
                       Encryption encryption, Resources resources, Health health, Config config) {
        this.storage = storage;
        this.performance = performance;
        this.cache = cache;
        this.compression = compression;
        this.encryption = encryption;
        this.resources = resources;
        this.health = health;
        this.config = config;
    }

    public Storage getStorage() {
        return storage;
    }

    public Performance getPerformance() {
        return performance;
    }

    public Cache getCache() {
        return cache;
    }

    public Compression getCompression() {
        return compression;
    }

    public Encryption getEncryption() {
        return encryption;
    }

    public Resources getResources() {
        return resources;
    }

    public Health getHealth() {
        return health;
    }

    public Config getConfig() {
        return config;
    }

    public static final class Storage {
        private final int totalKeys;
        private final long memoryBytes;
        private final long maxMemoryBytes;
        private final int walEntries;
        private final int walPending;
        private final int backups;
        private final int indexedFields;
        private final long indexEntries;

        public Storage(int totalKeys, long memoryBytes, long maxMemoryBytes, int walEntries, int walPending,
                       int backups, int indexedFields, long indexEntries) {
            this.totalKeys = totalKeys;
            this.memoryBytes = memoryBytes;
            this.maxMemoryBytes = maxMemoryBytes;
            this.walEntries = walEntries;
            this.walPending = walPending;
            this.backups = backups;
            this.indexedFields = indexedFields;
            this.indexEntries = indexEntries;
        }

        public int getTotalKeys() {
            return totalKeys;
        }

        public long getMemoryBytes() {
            return memoryBytes;
        }

        public long getMaxMemoryBytes() {
            return maxMemoryBytes;
        }

        /**
         * Memory used as a fraction of the budget.
         */
        public double getMemoryUsage() {
            return maxMemoryBytes > 0 ? (double) memoryBytes / maxMemoryBytes : 0.0;
        }

        public int getWalEntries() {
            return walEntries;
        }

        public int getWalPending() {
            return walPending;
        }

        public int getBackups() {
            return backups;
        }

        public int getIndexedFields() {
            return indexedFields;
        }

        public long getIndexEntries() {
            return indexEntries;
        }
    }

    public static final class Performance {
        private final long totalOperations;
        private final long gets;
        private final long sets;
        private final long deletes;
        private final long queries;
        private final long errors;
        private final long retries;
        private final double errorRate;
        private final double meanGetMs;
        private final double meanSetMs;
        private final double p99GetMs;
        private final double p99SetMs;

        public Performance(long totalOperations, long gets, long sets, long deletes, long queries,
                           long errors, long retries, double errorRate,
                           double meanGetMs, double meanSetMs, double p99GetMs, double p99SetMs) {
            this.totalOperations = totalOperations;
            this.gets = gets;
            this.sets = sets;
            this.deletes = deletes;
            this.queries = queries;
            this.errors = errors;
            this.retries = retries;
            this.errorRate = errorRate;
            this.meanGetMs = meanGetMs;
            this.meanSetMs = meanSetMs;
            this.p99GetMs = p99GetMs;
            this.p99SetMs = p99SetMs;
        }

        public long getTotalOperations() {
            return totalOperations;
        }

        public long getGets() {
            return gets;
        }

        public long getSets() {
            return sets;
        }

        public long getDeletes() {
            return deletes;
        }

        public long getQueries() {
            return queries;
        }

        public long getErrors() {
            return errors;
        }

        public long getRetries() {
            return retries;
        }

        public double getErrorRate() {
            return errorRate;
        }

        public double getMeanGetMs() {
            return meanGetMs;
        }

        public double getMeanSetMs() {
            return meanSetMs;
        }

        public double getP99GetMs() {
            return p99GetMs;
        }

        public double getP99SetMs() {
            return p99SetMs;
        }
    }

    public static final class Cache {
        private final boolean enabled;
        private final int entries;
        private final long bytes;
        private final long budgetBytes;
        private final long hits;
        private final long misses;
        private final long evictions;

        public Cache(boolean enabled, int entries, long bytes, long budgetBytes, long hits, long misses,
                     long evictions) {
            this.enabled = enabled;
            this.entries = entries;
            this.bytes = bytes;
            this.budgetBytes = budgetBytes;
            this.hits = hits;
            this.misses = misses;
            this.evictions = evictions;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public int getEntries() {
            return entries;
        }

        public long getBytes() {
            return bytes;
        }

        public long getBudgetBytes() {
            return budgetBytes;
        }

        public long getHits() {
            return hits;
        }

        public long getMisses() {
            return misses;
        }

        public double getHitRate() {
            long total = hits + misses;
            return total > 0 ? (double) hits / total : 0.0;
        }

        public long getEvictions() {
            return evictions;
        }
    }

    public static final class Compression {
        private final boolean enabled;
        private final long operations;
        private final long rejected;
        private final long bytesSaved;
        private final double averageRatio;

        public Compression(boolean enabled, long operations, long rejected, long bytesSaved, double averageRatio) {
            this.enabled = enabled;
            this.operations = operations;
            this.rejected = rejected;
            this.bytesSaved = bytesSaved;
            this.averageRatio = averageRatio;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public long getOperations() {
            return operations;
        }

        public long getRejected() {
            return rejected;
        }

        public long getBytesSaved() {
            return bytesSaved;
        }

        /**
         * Mean of original size / compressed size over kept compressions.
         */
        public double getAverageRatio() {
            return averageRatio;
        }
    }

    public static final class Encryption {
        private final boolean enabled;
        private final long encryptions;
        private final long decryptions;
        private final long decryptionFailures;

        public Encryption(boolean enabled, long encryptions, long decryptions, long decryptionFailures) {
            this.enabled = enabled;
            this.encryptions = encryptions;
            this.decryptions = decryptions;
            this.decryptionFailures = decryptionFailures;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public long getEncryptions() {
            return encryptions;
        }

        public long getDecryptions() {
            return decryptions;
        }

        public long getDecryptionFailures() {
            return decryptionFailures;
        }
    }

    public static final class Resources {
        private final double memoryPressure;
        private final String networkQuality;
        private final boolean batteryConstrained;
        private final boolean lowMemoryMode;
        private final String compressionMode;
        private final double cacheFraction;
        private final int batchSize;

        public Resources(double memoryPressure, String networkQuality, boolean batteryConstrained,
                         boolean lowMemoryMode, String compressionMode, double cacheFraction, int batchSize) {
            this.memoryPressure = memoryPressure;
            this.networkQuality = networkQuality;
            this.batteryConstrained = batteryConstrained;
            this.lowMemoryMode = lowMemoryMode;
            this.compressionMode = compressionMode;
            this.cacheFraction = cacheFraction;
            this.batchSize = batchSize;
        }

        public double getMemoryPressure() {
            return memoryPressure;
        }

        public String getNetworkQuality() {
            return networkQuality;
        }

        public boolean isBatteryConstrained() {
            return batteryConstrained;
        }

        public boolean isLowMemoryMode() {
            return lowMemoryMode;
        }

        public String getCompressionMode() {
            return compressionMode;
        }

        public double getCacheFraction() {
            return cacheFraction;
        }

        public int getBatchSize() {
            return batchSize;
        }
    }

    public static final class Health {
        private final Boolean lastCheckHealthy;
        private final long lastCheckAt;
        private final List<String> issues;
        private final long corruptRecords;
        private final int loggedErrors;
        private final long totalErrorsLogged;

        public Health(Boolean lastCheckHealthy, long lastCheckAt, List<String> issues, long corruptRecords,
                      int loggedErrors, long totalErrorsLogged) {
            this.lastCheckHealthy = lastCheckHealthy;
            this.lastCheckAt = lastCheckAt;
            this.issues = List.copyOf(issues);
            this.corruptRecords = corruptRecords;
            this.loggedErrors = loggedErrors;
            this.totalErrorsLogged = totalErrorsLogged;
        }

        /**
         * @return outcome of the last periodic check, or null if none has run
         */
        public Boolean getLastCheckHealthy() {
            return lastCheckHealthy;
        }

        public long getLastCheckAt() {
            return lastCheckAt;
        }

        public List<String> getIssues() {
            return issues;
        }

        public long getCorruptRecords() {
            return corruptRecords;
        }

        public int getLoggedErrors() {
            return loggedErrors;
        }

        public long getTotalErrorsLogged() {
            return totalErrorsLogged;
        }
    }

    public static final class Config {
        private final long maxMemorySize;
        private final boolean compressionEnabled;
        private final boolean encryptionEnabled;
        private final boolean transactionSupport;
        private final boolean cacheEnabled;
        private final boolean indexingEnabled;
        private final int retryAttempts;
        private final long retryDelayMs;
        private final int maxKeyLength;

        public Config(long maxMemorySize, boolean compressionEnabled, boolean encryptionEnabled,
                      boolean transactionSupport, boolean cacheEnabled, boolean indexingEnabled,
                      int retryAttempts, long retryDelayMs, int maxKeyLength) {
            this.maxMemorySize = maxMemorySize;
            this.compressionEnabled = compressionEnabled;
            this.encryptionEnabled = encryptionEnabled;
            this.transactionSupport = transactionSupport;
            this.cacheEnabled = cacheEnabled;
            this.indexingEnabled = indexingEnabled;
            this.retryAttempts = retryAttempts;
            this.retryDelayMs = retryDelayMs;
            this.maxKeyLength = maxKeyLength;
        }

        public long getMaxMemorySize() {
            return maxMemorySize;
        }

        public boolean isCompressionEnabled() {
            return compressionEnabled;
        }

        public boolean isEncryptionEnabled() {
            return encryptionEnabled;
        }

        public boolean isTransactionSupport() {
            return transactionSupport;
        }

        public boolean isCacheEnabled() {
            return cacheEnabled;
        }

        public boolean isIndexingEnabled() {
            return indexingEnabled;
        }

        public int getRetryAttempts() {
            return retryAttempts;
        }

        public long getRetryDelayMs() {
            return retryDelayMs;
        }

        public int getMaxKeyLength() {
            return maxKeyLength;
        }
    }
}
