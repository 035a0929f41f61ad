package com.flowstore.codec;

import java.util.Arrays;

/**
 * Output of {@link RecordCodec#encode}: the processed bytes and how they were produced.
 */
public final class EncodedPayload {

    private final byte[] payload;
    private final int originalSize;
    private final boolean compressed;
    private final boolean encrypted;
    private final CompressionAlgorithm algorithm;

    EncodedPayload(byte[] payload, int originalSize, boolean compressed, boolean encrypted,
                   CompressionAlgorithm algorithm) {
        this.payload = payload;
        this.originalSize = originalSize;
        this.compressed = compressed;
        this.encrypted = encrypted;
        this.algorithm = algorithm;
    }

    public byte[] getPayload() {
        return Arrays.copyOf(payload, payload.length);
    }

    public int getSize() {
        return payload.length;
    }

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
}
