package com.flowstore.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Thread-safe in-memory record store backed by a ConcurrentHashMap.
 * Tracks an estimate of the memory held by keys and payloads.
 */
public class InMemoryRecordStore implements RecordStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryRecordStore.class);
    private static final int ENTRY_OVERHEAD_BYTES = 48; // Estimated object overhead

    private final ConcurrentHashMap<String, Record> store;
    private final AtomicLong currentMemoryBytes;

    public InMemoryRecordStore() {
        this.store = new ConcurrentHashMap<>();
        this.currentMemoryBytes = new AtomicLong(0);
    }

    @Override
    public Optional<Record> put(String key, Record record) {
        validateKey(key);
        if (record == null) {
            throw new IllegalArgumentException("Record cannot be null");
        }
        Record previous = store.put(key, record);
        if (previous != null) {
            currentMemoryBytes.addAndGet(-estimateSize(key, previous));
        }
        currentMemoryBytes.addAndGet(estimateSize(key, record));
        logger.trace("PUT key={}, version={}, size={}, memoryUsed={}",
            key, record.getVersion(), record.getSize(), currentMemoryBytes.get());
        return Optional.ofNullable(previous);
    }

    @Override
    public Optional<Record> get(String key) {
        validateKey(key);
        return Optional.ofNullable(store.get(key));
    }

    @Override
    public Optional<Record> remove(String key) {
        validateKey(key);
        Record removed = store.remove(key);
        if (removed != null) {
            currentMemoryBytes.addAndGet(-estimateSize(key, removed));
        }
        logger.trace("REMOVE key={} -> {}", key, removed != null ? "REMOVED" : "NOT_FOUND");
        return Optional.ofNullable(removed);
    }

    @Override
    public boolean contains(String key) {
        validateKey(key);
        return store.containsKey(key);
    }

    @Override
    public Set<String> keys() {
        return Set.copyOf(store.keySet());
    }

    @Override
    public List<String> scanKeys(KeyPattern pattern) {
        if (pattern.matchesAll()) {
            return List.copyOf(store.keySet());
        }
        return store.keySet().stream()
            .filter(pattern::matches)
            .collect(Collectors.toList());
    }

    @Override
    public int size() {
        return store.size();
    }

    @Override
    public long memoryBytes() {
        return currentMemoryBytes.get();
    }

    @Override
    public void clear() {
        store.clear();
        currentMemoryBytes.set(0);
        logger.debug("Store cleared");
    }

    /**
     * Estimate the memory size of a stored entry.
     */
    private long estimateSize(String key, Record record) {
        long keySize = key.length() * 2L; // UTF-16 chars
        return keySize + record.getSize() + ENTRY_OVERHEAD_BYTES;
    }

    private void validateKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Key cannot be null or empty");
        }
    }
}
