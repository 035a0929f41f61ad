package com.flowstore.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-backed metrics for one engine instance.
 * Tracks operation counts, latencies, cache effectiveness, errors and retries.
 */
public class MetricsCollector {

    private final MeterRegistry registry;

    // Counters
    private final Counter getOps;
    private final Counter setOps;
    private final Counter deleteOps;
    private final Counter queryOps;
    private final Counter keysOps;
    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter errors;
    private final Counter retries;
    private final Counter corruptRecords;
    private final Counter decryptionFailures;

    // Timers
    private final Timer getLatency;
    private final Timer setLatency;
    private final Timer deleteLatency;
    private final Timer queryLatency;

    // Gauges
    private final AtomicLong storeSize;
    private final AtomicLong memoryBytes;
    private final AtomicLong cacheBytes;

    public MetricsCollector() {
        this(new SimpleMeterRegistry());
    }

    /**
     * @param registry the Micrometer registry to use
     */
    public MetricsCollector(MeterRegistry registry) {
        this.registry = registry;

        this.getOps = opCounter("get");
        this.setOps = opCounter("set");
        this.deleteOps = opCounter("delete");
        this.queryOps = opCounter("query");
        this.keysOps = opCounter("keys");

        this.cacheHits = Counter.builder("flowstore.cache")
            .tag("result", "hit")
            .description("Cache hits")
            .register(registry);

        this.cacheMisses = Counter.builder("flowstore.cache")
            .tag("result", "miss")
            .description("Cache misses")
            .register(registry);

        this.errors = Counter.builder("flowstore.errors")
            .description("Operations that failed")
            .register(registry);

        this.retries = Counter.builder("flowstore.retries")
            .description("Attempts repeated after a transient failure")
            .register(registry);

        this.corruptRecords = Counter.builder("flowstore.corrupt")
            .description("Records that could not be decoded")
            .register(registry);

        this.decryptionFailures = Counter.builder("flowstore.decryption.failures")
            .description("Payloads that failed authentication or decryption")
            .register(registry);

        this.getLatency = latencyTimer("get");
        this.setLatency = latencyTimer("set");
        this.deleteLatency = latencyTimer("delete");
        this.queryLatency = latencyTimer("query");

        this.storeSize = new AtomicLong();
        this.memoryBytes = new AtomicLong();
        this.cacheBytes = new AtomicLong();

        Gauge.builder("flowstore.store.size", storeSize, AtomicLong::get)
            .description("Number of records in the primary store")
            .register(registry);

        Gauge.builder("flowstore.memory.bytes", memoryBytes, AtomicLong::get)
            .description("Estimated bytes held by the primary store")
            .register(registry);

        Gauge.builder("flowstore.cache.bytes", cacheBytes, AtomicLong::get)
            .description("Payload bytes held by the cache")
            .register(registry);
    }

    private Counter opCounter(String operation) {
        return Counter.builder("flowstore.ops")
            .tag("operation", operation)
            .description("Total " + operation + " operations")
            .register(registry);
    }

    private Timer latencyTimer(String operation) {
        return Timer.builder("flowstore.latency")
            .tag("operation", operation)
            .description(operation + " operation latency")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);
    }

    // Operation recording

    public void recordGet(long durationNanos, boolean cacheHit) {
        getOps.increment();
        getLatency.record(durationNanos, TimeUnit.NANOSECONDS);
        if (cacheHit) {
            cacheHits.increment();
        } else {
            cacheMisses.increment();
        }
    }

    public void recordSet(long durationNanos) {
        setOps.increment();
        setLatency.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordDelete(long durationNanos) {
        deleteOps.increment();
        deleteLatency.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordQuery(long durationNanos) {
        queryOps.increment();
        queryLatency.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordKeys() {
        keysOps.increment();
    }

    public void recordError() {
        errors.increment();
    }

    public void recordRetry() {
        retries.increment();
    }

    public void recordCorruptRecord(boolean decryptionFailure) {
        corruptRecords.increment();
        if (decryptionFailure) {
            decryptionFailures.increment();
        }
    }

    // Gauges

    public void setStoreSize(int size) {
        storeSize.set(size);
    }

    public void setMemoryBytes(long bytes) {
        memoryBytes.set(bytes);
    }

    public void setCacheBytes(long bytes) {
        cacheBytes.set(bytes);
    }

    // Getters

    public long getTotalGetOps() {
        return (long) getOps.count();
    }

    public long getTotalSetOps() {
        return (long) setOps.count();
    }

    public long getTotalDeleteOps() {
        return (long) deleteOps.count();
    }

    public long getTotalQueryOps() {
        return (long) queryOps.count();
    }

    public long getTotalKeysOps() {
        return (long) keysOps.count();
    }

    /**
     * Sum of all counted operations.
     */
    public long getTotalOps() {
        return getTotalGetOps() + getTotalSetOps() + getTotalDeleteOps() + getTotalQueryOps() + getTotalKeysOps();
    }

    public long getTotalErrors() {
        return (long) errors.count();
    }

    public long getTotalRetries() {
        return (long) retries.count();
    }

    public long getCorruptRecords() {
        return (long) corruptRecords.count();
    }

    public long getDecryptionFailures() {
        return (long) decryptionFailures.count();
    }

    public long getCacheHits() {
        return (long) cacheHits.count();
    }

    public long getCacheMisses() {
        return (long) cacheMisses.count();
    }

    /**
     * Number of reads that consulted the cache.
     */
    public long getCacheLookups() {
        return getCacheHits() + getCacheMisses();
    }

    public double getHitRate() {
        double hits = cacheHits.count();
        double total = hits + cacheMisses.count();
        return total > 0 ? hits / total : 0.0;
    }

    public double getErrorRate() {
        long ops = getTotalOps();
        return ops > 0 ? (double) getTotalErrors() / ops : 0.0;
    }

    @SuppressWarnings("deprecation") // Using deprecated percentile API for simplicity
    public double getGetP99LatencyMs() {
        return getLatency.percentile(0.99, TimeUnit.MILLISECONDS);
    }

    @SuppressWarnings("deprecation") // Using deprecated percentile API for simplicity
    public double getSetP99LatencyMs() {
        return setLatency.percentile(0.99, TimeUnit.MILLISECONDS);
    }

    public double getGetMeanLatencyMs() {
        return getLatency.mean(TimeUnit.MILLISECONDS);
    }

    public double getSetMeanLatencyMs() {
        return setLatency.mean(TimeUnit.MILLISECONDS);
    }

    public double getDeleteMeanLatencyMs() {
        return deleteLatency.mean(TimeUnit.MILLISECONDS);
    }

    public double getQueryMeanLatencyMs() {
        return queryLatency.mean(TimeUnit.MILLISECONDS);
    }

    public long getStoreSize() {
        return storeSize.get();
    }

    public long getMemoryBytes() {
        return memoryBytes.get();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Print a summary of current metrics.
     *
     * @return formatted metrics string
     */
    public String summary() {
        return String.format(
            "FlowStore Metrics Summary%n" +
            "=========================%n" +
            "Operations: GET=%d, SET=%d, DELETE=%d, QUERY=%d, KEYS=%d%n" +
            "Cache: hits=%d, misses=%d, hitRate=%.2f%%%n" +
            "Errors: %d (rate=%.2f%%), retries=%d, corrupt=%d%n" +
            "Store: %d records, %d bytes%n" +
            "Latency (mean): GET=%.3fms, SET=%.3fms%n" +
            "Latency (p99):  GET=%.3fms, SET=%.3fms",
            getTotalGetOps(), getTotalSetOps(), getTotalDeleteOps(), getTotalQueryOps(), getTotalKeysOps(),
            getCacheHits(), getCacheMisses(), getHitRate() * 100,
            getTotalErrors(), getErrorRate() * 100, getTotalRetries(), getCorruptRecords(),
            getStoreSize(), getMemoryBytes(),
            getGetMeanLatencyMs(), getSetMeanLatencyMs(),
            getGetP99LatencyMs(), getSetP99LatencyMs()
        );
    }
}
