package com.flowstore.cache;

import com.flowstore.core.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.DoubleSupplier;

/**
 * Bounded mirror of hot records from the primary store.
 *
 * The cache only ever holds references to records that are also in the primary
 * store, so evicting an entry never loses data. When the cached payload bytes
 * exceed {@code maxMemoryBytes * cacheFraction}, the lowest-scoring
 * {@link #EVICTION_FRACTION} of entries is dropped, where
 * score = accessCount * (now - lastAccessedAt).
 */
public class RecordCache {

    private static final Logger logger = LoggerFactory.getLogger(RecordCache.class);

    public static final double EVICTION_FRACTION = 0.3;

    private final ConcurrentHashMap<String, Record> entries;
    private final long maxMemoryBytes;
    private final DoubleSupplier cacheFraction;
    private final Clock clock;
    private final boolean enabled;
    private final AtomicLong totalBytes;
    private final AtomicLong evictions;
    private final Object evictionLock = new Object();

    /**
     * @param maxMemoryBytes the engine's memory budget
     * @param cacheFraction  supplier of the fraction of the budget the cache may use
     * @param clock          clock used for eviction scoring
     * @param enabled        false to turn every operation into a no-op
     */
    public RecordCache(long maxMemoryBytes, DoubleSupplier cacheFraction, Clock clock, boolean enabled) {
        if (maxMemoryBytes <= 0) {
            throw new IllegalArgumentException("maxMemoryBytes must be positive, got: " + maxMemoryBytes);
        }
        this.entries = new ConcurrentHashMap<>();
        this.maxMemoryBytes = maxMemoryBytes;
        this.cacheFraction = Objects.requireNonNull(cacheFraction, "cacheFraction");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.enabled = enabled;
        this.totalBytes = new AtomicLong(0);
        this.evictions = new AtomicLong(0);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Optional<Record> get(String key) {
        if (!enabled) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Cache a record, replacing any older version, then trim if over budget.
     */
    public void put(String key, Record record) {
        if (!enabled) {
            return;
        }
        Record previous = entries.put(key, record);
        if (previous != null) {
            totalBytes.addAndGet(-previous.getSize());
        }
        totalBytes.addAndGet(record.getSize());
        evictIfOverBudget();
    }

    public void invalidate(String key) {
        if (!enabled) {
            return;
        }
        Record removed = entries.remove(key);
        if (removed != null) {
            totalBytes.addAndGet(-removed.getSize());
        }
    }

    /**
     * Evict the lowest-scoring entries if cached bytes exceed the budget.
     *
     * @return number of entries evicted
     */
    public int evictIfOverBudget() {
        if (!enabled || totalBytes.get() <= budgetBytes()) {
            return 0;
        }
        return evict();
    }

    /**
     * Evict the lowest-scoring entries regardless of the budget.
     *
     * @return number of entries evicted
     */
    public int evict() {
        if (!enabled) {
            return 0;
        }
        synchronized (evictionLock) {
            long now = clock.millis();
            List<Map.Entry<String, Record>> snapshot = new ArrayList<>(entries.entrySet());
            if (snapshot.isEmpty()) {
                return 0;
            }
            snapshot.sort(Comparator
                .comparingDouble((Map.Entry<String, Record> e) -> score(e.getValue(), now))
                .thenComparingLong(e -> e.getValue().getLastAccessedAt())
                .thenComparing(Map.Entry::getKey));

            int toRemove = Math.max(1, (int) Math.floor(snapshot.size() * EVICTION_FRACTION));
            int removed = 0;
            for (int i = 0; i < toRemove; i++) {
                Map.Entry<String, Record> victim = snapshot.get(i);
                // Conditional remove so a record refreshed during sorting survives
                if (entries.remove(victim.getKey(), victim.getValue())) {
                    totalBytes.addAndGet(-victim.getValue().getSize());
                    removed++;
                }
            }
            evictions.addAndGet(removed);
            logger.debug("Cache evicted {} of {} entries, bytes={}, budget={}",
                removed, snapshot.size(), totalBytes.get(), budgetBytes());
            return removed;
        }
    }

    static double score(Record record, long now) {
        long idle = Math.max(0, now - record.getLastAccessedAt());
        return (double) record.getAccessCount() * idle;
    }

    public long budgetBytes() {
        return (long) Math.floor(maxMemoryBytes * cacheFraction.getAsDouble());
    }

    public boolean contains(String key) {
        return enabled && entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public long totalBytes() {
        return totalBytes.get();
    }

    public long getEvictions() {
        return evictions.get();
    }

    public void clear() {
        entries.clear();
        totalBytes.set(0);
    }
}
