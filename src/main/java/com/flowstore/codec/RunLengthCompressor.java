package com.flowstore.codec;

import java.io.ByteArrayOutputStream;

/**
 * Run-length encoding.
 *
 * Runs longer than three bytes become {@code [0x00, count, byte]}. A literal
 * zero byte is written as {@code [0x00, 0x00]}; count is never zero for a run.
 */
final class RunLengthCompressor implements Compressor {

    private static final int MARKER = 0x00;
    private static final int MIN_RUN = 4;
    private static final int MAX_RUN = 255;

    @Override
    public byte[] compress(byte[] data) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length);
        int i = 0;
        while (i < data.length) {
            byte b = data[i];
            int count = 1;
            while (i + count < data.length && data[i + count] == b && count < MAX_RUN) {
                count++;
            }
            if (count >= MIN_RUN) {
                out.write(MARKER);
                out.write(count);
                out.write(b);
            } else {
                for (int j = 0; j < count; j++) {
                    writeLiteral(out, b);
                }
            }
            i += count;
        }
        return out.toByteArray();
    }

    @Override
    public byte[] decompress(byte[] data) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length * 2);
        int i = 0;
        while (i < data.length) {
            int b = data[i] & 0xFF;
            if (b != MARKER) {
                out.write(b);
                i++;
                continue;
            }
            if (i + 1 >= data.length) {
                throw new CorruptRecordException("Truncated run marker at offset " + i);
            }
            int count = data[i + 1] & 0xFF;
            if (count == 0) {
                out.write(0);
                i += 2;
                continue;
            }
            if (i + 2 >= data.length) {
                throw new CorruptRecordException("Truncated run at offset " + i);
            }
            int value = data[i + 2] & 0xFF;
            for (int j = 0; j < count; j++) {
                out.write(value);
            }
            i += 3;
        }
        return out.toByteArray();
    }

    private static void writeLiteral(ByteArrayOutputStream out, byte b) {
        if (b == MARKER) {
            out.write(MARKER);
            out.write(0);
        } else {
            out.write(b);
        }
    }
}
