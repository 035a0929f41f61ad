package com.flowstore.core;

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The unit of storage: a processed payload plus its metadata.
 * Payload bytes are copied on construction and on every read so callers
 * can never alias the stored array. Access statistics are the only mutable
 * state and are shared between the primary store and the cache.
 */
public final class Record {

    private final byte[] payload;
    private final RecordMetadata metadata;
    private final AtomicLong accessCount;
    private volatile long lastAccessedAt;

    /**
     * Create a record that has not been read yet.
     *
     * @param payload  the processed payload bytes
     * @param metadata metadata describing the payload
     */
    public Record(byte[] payload, RecordMetadata metadata) {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(metadata, "metadata");
        if (metadata.getSize() != payload.length) {
            throw new IllegalArgumentException("metadata size " + metadata.getSize()
                + " does not match payload length " + payload.length);
        }
        this.payload = Arrays.copyOf(payload, payload.length);
        this.metadata = metadata;
        this.accessCount = new AtomicLong(0);
        this.lastAccessedAt = metadata.getUpdatedAt();
    }

    /**
     * Get a copy of the payload bytes.
     *
     * @return copy of the payload
     */
    public byte[] getPayload() {
        return Arrays.copyOf(payload, payload.length);
    }

    /**
     * Get the raw payload bytes without copying.
     * Use with caution - do not modify the returned array.
     *
     * @return the internal payload array
     */
    public byte[] getPayloadUnsafe() {
        return payload;
    }

    public RecordMetadata getMetadata() {
        return metadata;
    }

    public long getVersion() {
        return metadata.getVersion();
    }

    public int getSize() {
        return payload.length;
    }

    public long getAccessCount() {
        return accessCount.get();
    }

    public long getLastAccessedAt() {
        return lastAccessedAt;
    }

    /**
     * Record a read of this entry.
     *
     * @param now the access time in milliseconds since epoch
     */
    public void touch(long now) {
        accessCount.incrementAndGet();
        lastAccessedAt = now;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Record that = (Record) o;
        return metadata.equals(that.metadata) && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return 31 * metadata.hashCode() + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Record{" +
               "payloadLength=" + payload.length +
               ", metadata=" + metadata +
               ", accessCount=" + accessCount.get() +
               '}';
    }
}
