package com.flowstore.resource;

/**
 * Tuning decisions derived from a {@link ResourceState}.
 * Immutable; the governor publishes a new instance whenever the state changes.
 */
public final class ResourcePolicy {

    public static final double DEFAULT_CACHE_FRACTION = 0.30;
    public static final double LOW_MEMORY_CACHE_FRACTION = 0.20;
    public static final int DEFAULT_BATCH_SIZE = 50;
    public static final int BATTERY_BATCH_SIZE = 10;

    private static final ResourcePolicy STANDARD = new ResourcePolicy(
        DEFAULT_CACHE_FRACTION, CompressionMode.ADAPTIVE, false, DEFAULT_BATCH_SIZE,
        false, false, NetworkQuality.GOOD);

    private final double cacheFraction;
    private final CompressionMode compressionMode;
    private final boolean forceCompression;
    private final int batchSize;
    private final boolean lowMemoryMode;
    private final boolean batteryOptimized;
    private final NetworkQuality networkQuality;

    public ResourcePolicy(double cacheFraction, CompressionMode compressionMode, boolean forceCompression,
                          int batchSize, boolean lowMemoryMode, boolean batteryOptimized,
                          NetworkQuality networkQuality) {
        this.cacheFraction = cacheFraction;
        this.compressionMode = compressionMode;
        this.forceCompression = forceCompression;
        this.batchSize = batchSize;
        this.lowMemoryMode = lowMemoryMode;
        this.batteryOptimized = batteryOptimized;
        this.networkQuality = networkQuality;
    }

    /**
     * Policy for a healthy environment.
     */
    public static ResourcePolicy standard() {
        return STANDARD;
    }

    /**
     * Fraction of the memory budget the cache may occupy.
     */
    public double getCacheFraction() {
        return cacheFraction;
    }

    public CompressionMode getCompressionMode() {
        return compressionMode;
    }

    /**
     * True when payloads should be compressed regardless of size.
     */
    public boolean isForceCompression() {
        return forceCompression;
    }

    /**
     * Number of WAL entries handed to a sink per flush.
     */
    public int getBatchSize() {
        return batchSize;
    }

    public boolean isLowMemoryMode() {
        return lowMemoryMode;
    }

    public boolean isBatteryOptimized() {
        return batteryOptimized;
    }

    public NetworkQuality getNetworkQuality() {
        return networkQuality;
    }

    @Override
    public String toString() {
        return "ResourcePolicy{" +
               "cacheFraction=" + cacheFraction +
               ", compressionMode=" + compressionMode +
               ", forceCompression=" + forceCompression +
               ", batchSize=" + batchSize +
               ", lowMemoryMode=" + lowMemoryMode +
               ", batteryOptimized=" + batteryOptimized +
               ", network=" + networkQuality +
               '}';
    }
}
