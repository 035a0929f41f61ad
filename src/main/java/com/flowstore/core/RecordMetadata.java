package com.flowstore.core;

import com.flowstore.codec.CompressionAlgorithm;

import java.util.Objects;

/**
 * Immutable description of how a record's payload was produced and which
 * write of the key it belongs to.
 */
public final class RecordMetadata {

    private final int originalSize;
    private final boolean compressed;
    private final boolean encrypted;
    private final CompressionAlgorithm algorithm;
    private final long createdAt;
    private final long updatedAt;
    private final long version;
    private final int size;
    private final long expiresAt;

    public RecordMetadata(int originalSize, boolean compressed, boolean encrypted,
                          CompressionAlgorithm algorithm, long createdAt, long updatedAt,
                          long version, int size) {
        this(originalSize, compressed, encrypted, algorithm, createdAt, updatedAt, version, size, 0L);
    }

    /**
     * @param expiresAt epoch millis after which the record reads as absent, or 0 for no expiry
     */
    public RecordMetadata(int originalSize, boolean compressed, boolean encrypted,
                          CompressionAlgorithm algorithm, long createdAt, long updatedAt,
                          long version, int size, long expiresAt) {
        Objects.requireNonNull(algorithm, "algorithm");
        if (compressed && algorithm == CompressionAlgorithm.NONE) {
            throw new IllegalArgumentException("Compressed payload requires an algorithm");
        }
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1, got: " + version);
        }
        this.originalSize = originalSize;
        this.compressed = compressed;
        this.encrypted = encrypted;
        this.algorithm = algorithm;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.version = version;
        this.size = size;
        this.expiresAt = expiresAt;
    }

    /**
     * Size of the serialized value before compression and encryption.
     */
    public int getOriginalSize() {
        return originalSize;
    }

    public boolean isCompressed() {
        return compressed;
    }

    public boolean isEncrypted() {
        return encrypted;
    }

    public CompressionAlgorithm getAlgorithm() {
        return algorithm;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    public long getVersion() {
        return version;
    }

    /**
     * Length of the stored payload in bytes.
     */
    public int getSize() {
        return size;
    }

    /**
     * Epoch millis after which the record has expired, or 0 if it never does.
     */
    public long getExpiresAt() {
        return expiresAt;
    }

    public boolean isExpired(long now) {
        return expiresAt > 0 && now > expiresAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RecordMetadata that = (RecordMetadata) o;
        return originalSize == that.originalSize &&
               compressed == that.compressed &&
               encrypted == that.encrypted &&
               createdAt == that.createdAt &&
               updatedAt == that.updatedAt &&
               version == that.version &&
               size == that.size &&
               expiresAt == that.expiresAt &&
               algorithm == that.algorithm;
    }

    @Override
    public int hashCode() {
        return Objects.hash(originalSize, compressed, encrypted, algorithm, createdAt, updatedAt, version, size,
            expiresAt);
    }

    @Override
    public String toString() {
        return "RecordMetadata{" +
               "version=" + version +
               ", size=" + size +
               ", originalSize=" + originalSize +
               ", compressed=" + compressed +
               ", encrypted=" + encrypted +
               ", algorithm=" + algorithm +
               (expiresAt > 0 ? ", expiresAt=" + expiresAt : "") +
               '}';
    }
}
