package com.flowstore.model;

/**
 * Outcome of a successful write.
 */
public final class WriteResult {

    private final String key;
    private final int size;
    private final long durationMs;
    private final boolean compressed;
    private final boolean encrypted;
    private final long version;

    public WriteResult(String key, int size, long durationMs, boolean compressed, boolean encrypted, long version) {
        this.key = key;
        this.size = size;
        this.durationMs = durationMs;
        this.compressed = compressed;
        this.encrypted = encrypted;
        this.version = version;
    }

    public String getKey() {
        return key;
    }

    /**
     * Stored payload size in bytes.
     */
    public int getSize() {
        return size;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public boolean isCompressed() {
        return compressed;
    }

    public boolean isEncrypted() {
        return encrypted;
    }

    public long getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return "WriteResult{" +
               "key='" + key + '\'' +
               ", size=" + size +
               ", durationMs=" + durationMs +
               ", compressed=" + compressed +
               ", encrypted=" + encrypted +
               ", version=" + version +
               '}';
    }
}
