package com.flowstore.backup;

import com.flowstore.core.Record;

/**
 * A point-in-time copy of a record.
 */
public final class Backup {

    private final String id;
    private final String originalKey;
    private final Record record;
    private final long timestamp;
    private final boolean deleted;

    Backup(String id, String originalKey, Record record, long timestamp, boolean deleted) {
        this.id = id;
        this.originalKey = originalKey;
        this.record = record;
        this.timestamp = timestamp;
        this.deleted = deleted;
    }

    public String getId() {
        return id;
    }

    public String getOriginalKey() {
        return originalKey;
    }

    public Record getRecord() {
        return record;
    }

    public long getTimestamp() {
        return timestamp;
    }

    /**
     * True if the copy was taken when the key was deleted.
     */
    public boolean isDeleted() {
        return deleted;
    }

    @Override
    public String toString() {
        return "Backup{" +
               "id='" + id + '\'' +
               ", originalKey='" + originalKey + '\'' +
               ", version=" + record.getVersion() +
               ", timestamp=" + timestamp +
               ", deleted=" + deleted +
               '}';
    }
}
