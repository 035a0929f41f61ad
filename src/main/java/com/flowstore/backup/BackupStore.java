package com.flowstore.backup;

import com.flowstore.core.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Holds backup copies of records, keyed {@code backup_<key>_<timestamp>} for
 * copies taken on write and {@code deleted_<key>_<timestamp>} for copies taken
 * on delete.
 *
 * Above {@code maxBackups} the oldest half is dropped; {@link #collectGarbage()}
 * removes copies older than the retention window.
 */
public class BackupStore {

    private static final Logger logger = LoggerFactory.getLogger(BackupStore.class);

    public static final int DEFAULT_MAX_BACKUPS = 1000;
    public static final long DEFAULT_RETENTION_MS = 24 * 60 * 60 * 1000L;

    private final Clock clock;
    private final int maxBackups;
    private final long retentionMs;
    private final LinkedHashMap<String, Backup> backups = new LinkedHashMap<>();

    public BackupStore(Clock clock) {
        this(clock, DEFAULT_MAX_BACKUPS, DEFAULT_RETENTION_MS);
    }

    public BackupStore(Clock clock, int maxBackups, long retentionMs) {
        if (maxBackups < 2) {
            throw new IllegalArgumentException("maxBackups must be at least 2, got: " + maxBackups);
        }
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxBackups = maxBackups;
        this.retentionMs = retentionMs;
    }

    /**
     * Store a copy of a record.
     *
     * @param key     the key the record belongs to
     * @param record  the record to copy
     * @param deleted true if the copy is taken because the key is being deleted
     * @return the backup id
     */
    public synchronized String create(String key, Record record, boolean deleted) {
        long now = clock.millis();
        String base = (deleted ? "deleted_" : "backup_") + key + "_" + now;
        String id = base;
        for (int n = 1; backups.containsKey(id); n++) {
            id = base + "-" + n;
        }
        Record copy = new Record(record.getPayloadUnsafe(), record.getMetadata());
        backups.put(id, new Backup(id, key, copy, now, deleted));

        if (backups.size() > maxBackups) {
            int removed = dropOldest(maxBackups / 2);
            logger.debug("Backup store over {} entries, dropped {} oldest", maxBackups, removed);
        }
        return id;
    }

    public synchronized Optional<Backup> get(String backupId) {
        return Optional.ofNullable(backups.get(backupId));
    }

    /**
     * Backups of one key, oldest first.
     */
    public synchronized List<Backup> list(String key) {
        List<Backup> result = new ArrayList<>();
        for (Backup backup : backups.values()) {
            if (backup.getOriginalKey().equals(key)) {
                result.add(backup);
            }
        }
        return result;
    }

    /**
     * Remove backups older than the retention window.
     *
     * @return number removed
     */
    public synchronized int collectGarbage() {
        long cutoff = clock.millis() - retentionMs;
        int removed = 0;
        Iterator<Map.Entry<String, Backup>> it = backups.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue().getTimestamp() < cutoff) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            logger.debug("Removed {} expired backups", removed);
        }
        return removed;
    }

    public synchronized int size() {
        return backups.size();
    }

    public synchronized long totalBytes() {
        long total = 0;
        for (Backup backup : backups.values()) {
            total += backup.getRecord().getSize();
        }
        return total;
    }

    private int dropOldest(int count) {
        int removed = 0;
        Iterator<String> it = backups.keySet().iterator();
        while (removed < count && it.hasNext()) {
            it.next();
            it.remove();
            removed++;
        }
        return removed;
    }
}
