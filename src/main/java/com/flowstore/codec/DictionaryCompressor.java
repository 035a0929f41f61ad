package com.flowstore.codec;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Replaces common English phrases with single marker bytes.
 *
 * Markers occupy 0xF8-0xFF, which never appear in UTF-8 text. Any input byte
 * at or above {@link #ESCAPE} is written as ESCAPE followed by the byte, so
 * arbitrary binary input still round-trips.
 */
final class DictionaryCompressor implements Compressor {

    static final int ESCAPE = 0xF7;
    private static final int FIRST_MARKER = 0xF8;

    private static final byte[][] PHRASES = {
        bytes("the "), bytes("and "), bytes("for "), bytes("are "),
        bytes("with "), bytes("this "), bytes("that "), bytes("from ")
    };

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }

    @Override
    public byte[] compress(byte[] data) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length);
        int i = 0;
        while (i < data.length) {
            int phrase = matchPhrase(data, i);
            if (phrase >= 0) {
                out.write(FIRST_MARKER + phrase);
                i += PHRASES[phrase].length;
                continue;
            }
            int b = data[i] & 0xFF;
            if (b >= ESCAPE) {
                out.write(ESCAPE);
            }
            out.write(b);
            i++;
        }
        return out.toByteArray();
    }

    @Override
    public byte[] decompress(byte[] data) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length * 2);
        int i = 0;
        while (i < data.length) {
            int b = data[i] & 0xFF;
            if (b == ESCAPE) {
                if (i + 1 >= data.length) {
                    throw new CorruptRecordException("Dangling escape byte at offset " + i);
                }
                out.write(data[i + 1] & 0xFF);
                i += 2;
            } else if (b >= FIRST_MARKER) {
                byte[] phrase = PHRASES[b - FIRST_MARKER];
                out.write(phrase, 0, phrase.length);
                i++;
            } else {
                out.write(b);
                i++;
            }
        }
        return out.toByteArray();
    }

    private static int matchPhrase(byte[] data, int offset) {
        for (int p = 0; p < PHRASES.length; p++) {
            byte[] phrase = PHRASES[p];
            if (offset + phrase.length > data.length) {
                continue;
            }
            boolean match = true;
            for (int j = 0; j < phrase.length; j++) {
                if (data[offset + j] != phrase[j]) {
                    match = false;
                    break;
                }
            }
            if (match) {
                return p;
            }
        }
        return -1;
    }
}
