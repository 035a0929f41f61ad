package com.flowstore.codec;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * LZ77 with a hash-chained 64KB window.
 *
 * Token format:
 * - control {@code 0x00-0x7F}: literal run of (control + 1) bytes follows
 * - control {@code 0x80-0xFF}: back-reference of length (control &amp; 0x7F) + 4,
 *   followed by a 2-byte big-endian distance (1..65535)
 *
 * Matching is deterministic: candidates are visited newest first and the first
 * longest match wins.
 */
final class Lz77Compressor implements Compressor {

    private static final int MIN_MATCH = 4;
    private static final int MAX_MATCH = 0x7F + MIN_MATCH;
    private static final int MAX_LITERAL_RUN = 0x80;
    private static final int WINDOW = 0xFFFF;
    private static final int MAX_CHAIN = 64;
    private static final int HASH_BITS = 15;

    @Override
    public byte[] compress(byte[] data) {
        int n = data.length;
        ByteArrayOutputStream out = new ByteArrayOutputStream(n / 2 + 16);
        int[] head = new int[1 << HASH_BITS];
        Arrays.fill(head, -1);
        int[] prev = new int[Math.max(n, 1)];

        int literalStart = 0;
        int pos = 0;
        while (pos < n) {
            int bestLength = 0;
            int bestDistance = 0;
            if (pos + MIN_MATCH <= n) {
                int limit = Math.min(MAX_MATCH, n - pos);
                int candidate = head[hash(data, pos)];
                int chain = 0;
                while (candidate >= 0 && pos - candidate <= WINDOW && chain < MAX_CHAIN) {
                    int length = matchLength(data, candidate, pos, limit);
                    if (length > bestLength) {
                        bestLength = length;
                        bestDistance = pos - candidate;
                        if (length == limit) {
                            break;
                        }
                    }
                    candidate = prev[candidate];
                    chain++;
                }
            }

            if (bestLength >= MIN_MATCH) {
                writeLiterals(out, data, literalStart, pos);
                out.write(0x80 | (bestLength - MIN_MATCH));
                out.write((bestDistance >>> 8) & 0xFF);
                out.write(bestDistance & 0xFF);
                int end = pos + bestLength;
                while (pos < end) {
                    insert(data, pos, head, prev);
                    pos++;
                }
                literalStart = pos;
            } else {
                insert(data, pos, head, prev);
                pos++;
            }
        }
        writeLiterals(out, data, literalStart, n);
        return out.toByteArray();
    }

    @Override
    public byte[] decompress(byte[] data) {
        byte[] out = new byte[Math.max(16, data.length * 2)];
        int size = 0;
        int i = 0;
        while (i < data.length) {
            int control = data[i++] & 0xFF;
            if (control < 0x80) {
                int run = control + 1;
                if (i + run > data.length) {
                    throw new CorruptRecordException("Truncated literal run at offset " + (i - 1));
                }
                out = ensureCapacity(out, size + run);
                System.arraycopy(data, i, out, size, run);
                size += run;
                i += run;
            } else {
                if (i + 2 > data.length) {
                    throw new CorruptRecordException("Truncated back-reference at offset " + (i - 1));
                }
                int length = (control & 0x7F) + MIN_MATCH;
                int distance = ((data[i] & 0xFF) << 8) | (data[i + 1] & 0xFF);
                i += 2;
                if (distance == 0 || distance > size) {
                    throw new CorruptRecordException("Back-reference distance " + distance
                        + " outside decoded window of " + size + " bytes");
                }
                out = ensureCapacity(out, size + length);
                int from = size - distance;
                for (int j = 0; j < length; j++) {
                    out[size++] = out[from + j];
                }
            }
        }
        return Arrays.copyOf(out, size);
    }

    private static void writeLiterals(ByteArrayOutputStream out, byte[] data, int from, int to) {
        int offset = from;
        while (offset < to) {
            int run = Math.min(MAX_LITERAL_RUN, to - offset);
            out.write(run - 1);
            out.write(data, offset, run);
            offset += run;
        }
    }

    private static int matchLength(byte[] data, int candidate, int pos, int limit) {
        int length = 0;
        while (length < limit && data[candidate + length] == data[pos + length]) {
            length++;
        }
        return length;
    }

    private static void insert(byte[] data, int pos, int[] head, int[] prev) {
        if (pos + MIN_MATCH > data.length) {
            return;
        }
        int h = hash(data, pos);
        prev[pos] = head[h];
        head[h] = pos;
    }

    private static int hash(byte[] data, int pos) {
        int v = ((data[pos] & 0xFF) << 24)
              | ((data[pos + 1] & 0xFF) << 16)
              | ((data[pos + 2] & 0xFF) << 8)
              | (data[pos + 3] & 0xFF);
        return (v * 0x9E3779B1) >>> (32 - HASH_BITS);
    }

    private static byte[] ensureCapacity(byte[] buffer, int required) {
        if (required <= buffer.length) {
            return buffer;
        }
        return Arrays.copyOf(buffer, Math.max(required, buffer.length * 2));
    }
}
