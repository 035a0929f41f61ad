package com.flowstore.core;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Primary storage of records by key. The engine owns every record it puts here;
 * implementations must be thread-safe.
 *
 * The in-memory implementation is the only one shipped, but a durable backend can
 * sit behind the same contract. Backends signal recoverable failures with
 * {@link TransientStorageException} so the engine retries them.
 */
public interface RecordStore {

    /**
     * Store a record, replacing any previous one.
     *
     * @param key    the key
     * @param record the record
     * @return the previous record if one existed, empty otherwise
     */
    Optional<Record> put(String key, Record record);

    /**
     * Look up a record.
     *
     * @param key the key
     * @return the record if present, empty otherwise
     */
    Optional<Record> get(String key);

    /**
     * Remove a record.
     *
     * @param key the key
     * @return the removed record if one existed, empty otherwise
     */
    Optional<Record> remove(String key);

    /**
     * Check whether a key is present.
     */
    boolean contains(String key);

    /**
     * Snapshot of all keys.
     */
    Set<String> keys();

    /**
     * All keys matching a glob pattern, in no particular order.
     *
     * @param pattern the pattern
     * @return matching keys
     */
    List<String> scanKeys(KeyPattern pattern);

    /**
     * Number of stored records.
     */
    int size();

    /**
     * Estimated memory held by stored keys and payloads, in bytes.
     */
    long memoryBytes();

    /**
     * Remove every record.
     */
    void clear();
}
