package com.flowstore.wal;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * In-memory intent log of mutating operations.
 *
 * Growth is bounded two ways: entries older than the retention window are
 * dropped by {@link #prune()}, and when more than {@code maxEntries} are held the
 * oldest are dropped down to half the cap. While a {@link WalSink} is attached,
 * neither rule drops an entry the sink has not consumed yet.
 */
public class WriteAheadLog {

    private static final Logger logger = LoggerFactory.getLogger(WriteAheadLog.class);

    private final Clock clock;
    private final long retentionMs;
    private final int maxEntries;
    private final Deque<WalEntry> entries = new ArrayDeque<>();
    private final Object walLock = new Object();
    private final Object flushLock = new Object();
    private long lastId;
    private long consumedThrough;
    private long appended;
    private long dropped;
    private volatile WalSink sink;

    /**
     * @param clock       clock for entry timestamps and retention
     * @param retentionMs how long entries are kept
     * @param maxEntries  entry count above which the log is trimmed
     */
    public WriteAheadLog(Clock clock, long retentionMs, int maxEntries) {
        if (retentionMs <= 0) {
            throw new IllegalArgumentException("retentionMs must be positive, got: " + retentionMs);
        }
        if (maxEntries < 2) {
            throw new IllegalArgumentException("maxEntries must be at least 2, got: " + maxEntries);
        }
        this.clock = Objects.requireNonNull(clock, "clock");
        this.retentionMs = retentionMs;
        this.maxEntries = maxEntries;
    }

    /**
     * Append an entry. Must be called before the mutation is applied.
     *
     * @param operation the operation
     * @param key       the key being mutated
     * @param value     the value written, or null for DELETE
     * @return the entry id
     */
    public long append(WalOperation operation, String key, JsonNode value) {
        synchronized (walLock) {
            long id = ++lastId;
            entries.addLast(new WalEntry(id, operation, key, value, clock.millis()));
            appended++;
            if (entries.size() > maxEntries) {
                int removed = dropOldest(entries.size() - maxEntries / 2);
                logger.debug("WAL over {} entries, dropped {} oldest", maxEntries, removed);
            }
            logger.trace("WAL append id={} op={} key={}", id, operation, key);
            return id;
        }
    }

    /**
     * Drop entries older than the retention window.
     *
     * @return number of entries dropped
     */
    public int prune() {
        long cutoff = clock.millis() - retentionMs;
        synchronized (walLock) {
            int removed = 0;
            Iterator<WalEntry> it = entries.iterator();
            while (it.hasNext()) {
                WalEntry entry = it.next();
                if (entry.getTimestamp() > cutoff || !isConsumed(entry)) {
                    break;
                }
                it.remove();
                removed++;
            }
            dropped += removed;
            if (removed > 0) {
                logger.debug("WAL pruned {} entries older than {}ms", removed, retentionMs);
            }
            return removed;
        }
    }

    /**
     * Hand up to {@code batchSize} unconsumed entries to the sink.
     *
     * @param batchSize maximum entries to deliver
     * @return number of entries the sink accepted
     */
    public int flush(int batchSize) {
        WalSink target = sink;
        if (target == null || batchSize <= 0) {
            return 0;
        }
        synchronized (flushLock) {
            List<WalEntry> batch = new ArrayList<>(batchSize);
            synchronized (walLock) {
                for (WalEntry entry : entries) {
                    if (entry.getId() > consumedThrough) {
                        batch.add(entry);
                        if (batch.size() == batchSize) {
                            break;
                        }
                    }
                }
            }
            if (batch.isEmpty()) {
                return 0;
            }
            try {
                target.accept(List.copyOf(batch));
            } catch (Exception e) {
                logger.warn("WAL sink rejected batch of {} entries: {}", batch.size(), e.getMessage());
                return 0;
            }
            synchronized (walLock) {
                consumedThrough = batch.get(batch.size() - 1).getId();
            }
            return batch.size();
        }
    }

    /**
     * Attach a sink. Entries appended before this call are delivered too.
     *
     * @param sink the sink, or null to detach
     */
    public void setSink(WalSink sink) {
        synchronized (walLock) {
            this.sink = sink;
            if (sink != null && !entries.isEmpty()) {
                consumedThrough = entries.peekFirst().getId() - 1;
            }
        }
    }

    /**
     * Snapshot of the retained entries in id order.
     */
    public List<WalEntry> entries() {
        synchronized (walLock) {
            return List.copyOf(entries);
        }
    }

    public int size() {
        synchronized (walLock) {
            return entries.size();
        }
    }

    public long lastId() {
        synchronized (walLock) {
            return lastId;
        }
    }

    /**
     * Entries retained but not yet consumed by the sink.
     */
    public int pending() {
        synchronized (walLock) {
            if (sink == null) {
                return 0;
            }
            int count = 0;
            for (WalEntry entry : entries) {
                if (entry.getId() > consumedThrough) {
                    count++;
                }
            }
            return count;
        }
    }

    public long getAppendedCount() {
        synchronized (walLock) {
            return appended;
        }
    }

    public long getDroppedCount() {
        synchronized (walLock) {
            return dropped;
        }
    }

    private int dropOldest(int count) {
        int removed = 0;
        while (removed < count && !entries.isEmpty() && isConsumed(entries.peekFirst())) {
            entries.removeFirst();
            removed++;
        }
        dropped += removed;
        return removed;
    }

    private boolean isConsumed(WalEntry entry) {
        return sink == null || entry.getId() <= consumedThrough;
    }
}
