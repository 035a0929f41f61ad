package com.flowstore.codec;

/**
 * Compression algorithms a payload may be stored under.
 * The algorithm is recorded in the record metadata so reads can reverse it.
 */
public enum CompressionAlgorithm {

    /** Stored as-is. */
    NONE(null),

    /** Dictionary substitution of common phrases. Cheapest, lowest ratio. */
    FAST(new DictionaryCompressor()),

    /** Run-length encoding of repeated bytes. */
    SIMPLE(new RunLengthCompressor()),

    /** LZ77 longest-match compression. Slowest, highest ratio. */
    LZ77(new Lz77Compressor());

    private final Compressor compressor;

    CompressionAlgorithm(Compressor compressor) {
        this.compressor = compressor;
    }

    public byte[] compress(byte[] data) {
        return compressor == null ? data.clone() : compressor.compress(data);
    }

    public byte[] decompress(byte[] data) {
        return compressor == null ? data.clone() : compressor.decompress(data);
    }
}
