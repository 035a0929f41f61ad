package com.flowstore.index;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

/**
 * Equality index over the top-level string and number fields of stored objects:
 * {@code field -> value -> keys}.
 *
 * A reverse map remembers what each key was indexed under, so an overwrite only
 * touches the fields whose values changed. Every change to a field's value map
 * happens inside {@code compute} on the field bin, which keeps concurrent writers
 * and garbage collection from losing each other's updates.
 */
public class SecondaryIndex {

    private static final Logger logger = LoggerFactory.getLogger(SecondaryIndex.class);

    private final ConcurrentHashMap<String, Map<IndexValue, Set<String>>> index;
    private final ConcurrentHashMap<String, Map<String, IndexValue>> indexedByKey;

    public SecondaryIndex() {
        this.index = new ConcurrentHashMap<>();
        this.indexedByKey = new ConcurrentHashMap<>();
    }

    /**
     * Index a freshly written value, replacing whatever the key was indexed under before.
     *
     * @param key   the key
     * @param value the value written
     */
    public void indexOnWrite(String key, JsonNode value) {
        Map<String, IndexValue> fields = extractFields(value);
        Map<String, IndexValue> previous = fields.isEmpty()
            ? indexedByKey.remove(key)
            : indexedByKey.put(key, fields);

        if (previous != null) {
            for (Map.Entry<String, IndexValue> old : previous.entrySet()) {
                if (!old.getValue().equals(fields.get(old.getKey()))) {
                    removeEntry(old.getKey(), old.getValue(), key);
                }
            }
        }
        for (Map.Entry<String, IndexValue> field : fields.entrySet()) {
            if (previous == null || !field.getValue().equals(previous.get(field.getKey()))) {
                addEntry(field.getKey(), field.getValue(), key);
            }
        }
    }

    /**
     * Remove a key from every index entry that references it.
     *
     * @param key the key
     */
    public void removeFromIndex(String key) {
        Map<String, IndexValue> previous = indexedByKey.remove(key);
        if (previous == null) {
            return;
        }
        for (Map.Entry<String, IndexValue> old : previous.entrySet()) {
            removeEntry(old.getKey(), old.getValue(), key);
        }
    }

    /**
     * Keys indexed under {@code field == value}.
     *
     * @return a snapshot of matching keys; empty if the value is not indexable
     */
    public Set<String> findByField(String field, JsonNode value) {
        IndexValue normalized = IndexValue.of(value);
        if (normalized == null) {
            return Collections.emptySet();
        }
        Map<IndexValue, Set<String>> values = index.get(field);
        if (values == null) {
            return Collections.emptySet();
        }
        Set<String> keys = values.get(normalized);
        return keys == null ? Collections.emptySet() : Set.copyOf(keys);
    }

    /**
     * True if at least one stored value has an indexable value for this field.
     */
    public boolean isIndexed(String field) {
        return index.containsKey(field);
    }

    /**
     * Drop a single stale entry discovered while materializing a query.
     */
    public void prune(String key, String field, JsonNode value) {
        IndexValue normalized = IndexValue.of(value);
        if (normalized == null) {
            return;
        }
        removeEntry(field, normalized, key);
        indexedByKey.computeIfPresent(key, (k, fields) -> {
            if (!normalized.equals(fields.get(field))) {
                return fields;
            }
            Map<String, IndexValue> copy = new HashMap<>(fields);
            copy.remove(field);
            return copy.isEmpty() ? null : copy;
        });
        logger.debug("Pruned stale index entry {}={} for key {}", field, normalized, key);
    }

    /**
     * Remove keys that are no longer live, then empty value sets and field maps.
     * Only safe when no writer touches the index concurrently.
     *
     * @param isLive predicate telling whether a key still exists in the primary store
     * @return number of dangling key references removed
     */
    public int collectGarbage(Predicate<String> isLive) {
        return collectGarbage(isLive, (key, action) -> action.run());
    }

    /**
     * Remove keys that are no longer live, then empty value sets and field maps.
     * Each removal re-checks liveness inside {@code keyLock}, so a key that was
     * deleted and written again after the first check keeps its new entries.
     *
     * @param isLive predicate telling whether a key still exists in the primary store
     * @param keyLock runs an action while holding the lock that serializes writes to a key
     * @return number of dangling key references removed
     */
    public int collectGarbage(Predicate<String> isLive, BiConsumer<String, Runnable> keyLock) {
        int dangling = 0;
        for (String key : indexedByKey.keySet()) {
            if (isLive.test(key)) {
                continue;
            }
            boolean[] removed = {false};
            keyLock.accept(key, () -> {
                if (!isLive.test(key)) {
                    removeFromIndex(key);
                    removed[0] = true;
                }
            });
            if (removed[0]) {
                dangling++;
            }
        }
        int emptyFields = 0;
        for (String field : index.keySet()) {
            Map<IndexValue, Set<String>> result = index.computeIfPresent(field, (f, values) -> {
                values.values().removeIf(Set::isEmpty);
                return values.isEmpty() ? null : values;
            });
            if (result == null) {
                emptyFields++;
            }
        }
        if (dangling > 0 || emptyFields > 0) {
            logger.debug("Index GC removed {} dangling keys and {} empty fields", dangling, emptyFields);
        }
        return dangling;
    }

    /**
     * Number of indexed fields.
     */
    public int fieldCount() {
        return index.size();
    }

    /**
     * Total number of key references across all index entries.
     */
    public long entryCount() {
        long count = 0;
        for (Map<IndexValue, Set<String>> values : index.values()) {
            for (Set<String> keys : values.values()) {
                count += keys.size();
            }
        }
        return count;
    }

    private void addEntry(String field, IndexValue value, String key) {
        index.compute(field, (f, values) -> {
            Map<IndexValue, Set<String>> map = values != null ? values : new ConcurrentHashMap<>();
            map.computeIfAbsent(value, v -> ConcurrentHashMap.newKeySet()).add(key);
            return map;
        });
    }

    private void removeEntry(String field, IndexValue value, String key) {
        index.computeIfPresent(field, (f, values) -> {
            values.computeIfPresent(value, (v, keys) -> {
                keys.remove(key);
                return keys.isEmpty() ? null : keys;
            });
            return values.isEmpty() ? null : values;
        });
    }

    private static Map<String, IndexValue> extractFields(JsonNode value) {
        if (value == null || !value.isObject()) {
            return Collections.emptyMap();
        }
        Map<String, IndexValue> fields = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = value.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            IndexValue normalized = IndexValue.of(field.getValue());
            if (normalized != null) {
                fields.put(field.getKey(), normalized);
            }
        }
        return fields;
    }
}
