package com.flowstore.codec;

/**
 * A lossless byte compressor. For every input {@code b},
 * {@code decompress(compress(b))} must equal {@code b}.
 */
public interface Compressor {

    byte[] compress(byte[] data);

    /**
     * @throws CorruptRecordException if the input was not produced by {@link #compress}
     */
    byte[] decompress(byte[] data);
}
