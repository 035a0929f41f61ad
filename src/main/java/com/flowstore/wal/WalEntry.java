package com.flowstore.wal;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * One intent record in the write-ahead log.
 */
public final class WalEntry {

    private final long id;
    private final WalOperation operation;
    private final String key;
    private final JsonNode value; // null for DELETE
    private final long timestamp;

    public WalEntry(long id, WalOperation operation, String key, JsonNode value, long timestamp) {
        this.id = id;
        this.operation = Objects.requireNonNull(operation, "operation");
        this.key = Objects.requireNonNull(key, "key");
        this.value = value != null ? value.deepCopy() : null;
        this.timestamp = timestamp;
    }

    /**
     * Sequence number, strictly increasing in append order.
     */
    public long getId() {
        return id;
    }

    public WalOperation getOperation() {
        return operation;
    }

    public String getKey() {
        return key;
    }

    /**
     * Get a copy of the logged value.
     *
     * @return the value written, or null for DELETE
     */
    public JsonNode getValue() {
        return value != null ? value.deepCopy() : null;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "WalEntry{" +
               "id=" + id +
               ", operation=" + operation +
               ", key='" + key + '\'' +
               ", timestamp=" + timestamp +
               '}';
    }
}
