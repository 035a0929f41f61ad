package com.flowstore.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowstore.codec.crypto.PayloadCipher;
import com.flowstore.core.RecordMetadata;
import com.flowstore.resource.CompressionMode;
import com.flowstore.resource.NetworkQuality;
import com.flowstore.resource.ResourcePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * Serializes values to JSON bytes, then optionally compresses and encrypts them.
 * Decoding reverses the pipeline: decrypt, decompress, parse.
 *
 * Compression choices depend only on the payload size and the {@link ResourcePolicy}
 * passed in, so pinning the policy makes the choice reproducible.
 */
public class RecordCodec {

    private static final Logger logger = LoggerFactory.getLogger(RecordCodec.class);

    /** Payloads below this size are compressed only on a degraded network. */
    public static final int SMALL_PAYLOAD_BYTES = 50;
    /** Above this size the codec moves from dictionary substitution to run-length encoding. */
    public static final int MEDIUM_PAYLOAD_BYTES = 1000;
    /** Above this size the codec always uses LZ77. */
    public static final int LARGE_PAYLOAD_BYTES = 10_000;
    /** Compressed output must be below this fraction of the input to be kept. */
    public static final double MIN_SAVINGS_RATIO = 0.9;

    private final ObjectMapper mapper;
    private final PayloadCipher cipher;
    private final boolean compressionEnabled;
    private final int compressionThreshold;

    private final LongAdder compressionOperations = new LongAdder();
    private final LongAdder compressionRejected = new LongAdder();
    private final LongAdder bytesSaved = new LongAdder();
    private final DoubleAdder ratioSum = new DoubleAdder();
    private final LongAdder encryptionOperations = new LongAdder();
    private final LongAdder decryptionOperations = new LongAdder();

    /**
     * @param mapper               JSON mapper
     * @param cipher               payload cipher, or null when encryption is disabled
     * @param compressionEnabled   global compression switch
     * @param compressionThreshold payload size above which compression is always attempted
     */
    public RecordCodec(ObjectMapper mapper, PayloadCipher cipher, boolean compressionEnabled,
                       int compressionThreshold) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cipher = cipher;
        this.compressionEnabled = compressionEnabled;
        this.compressionThreshold = compressionThreshold;
    }

    /**
     * Encode a value.
     *
     * @param value    the value to store
     * @param compress false to skip compression for this write
     * @param encrypt  false to skip encryption for this write
     * @param policy   current resource policy
     * @return the processed payload
     */
    public EncodedPayload encode(JsonNode value, boolean compress, boolean encrypt, ResourcePolicy policy) {
        byte[] processed = serialize(value);
        int originalSize = processed.length;
        boolean compressed = false;
        CompressionAlgorithm algorithm = CompressionAlgorithm.NONE;

        if (compressionEnabled && compress && shouldCompress(originalSize, policy)) {
            CompressionAlgorithm candidate = chooseAlgorithm(originalSize, policy);
            byte[] output = candidate.compress(processed);
            if (output.length < originalSize * MIN_SAVINGS_RATIO) {
                bytesSaved.add(originalSize - output.length);
                ratioSum.add((double) originalSize / Math.max(1, output.length));
                compressionOperations.increment();
                logger.trace("Compressed {} -> {} bytes with {}", originalSize, output.length, candidate);
                processed = output;
                compressed = true;
                algorithm = candidate;
            } else {
                compressionRejected.increment();
            }
        }

        boolean encrypted = false;
        if (encrypt && cipher != null) {
            processed = cipher.encrypt(processed);
            encrypted = true;
            encryptionOperations.increment();
        }
        return new EncodedPayload(processed, originalSize, compressed, encrypted, algorithm);
    }

    /**
     * Decode a stored payload back into a value.
     *
     * @param payload  the stored bytes
     * @param metadata metadata written alongside the payload
     * @return the value
     * @throws CorruptRecordException if any stage of the pipeline fails
     */
    public JsonNode decode(byte[] payload, RecordMetadata metadata) {
        byte[] processed = payload;
        if (metadata.isEncrypted()) {
            if (cipher == null) {
                throw new CorruptRecordException("Record is encrypted but no encryption key is configured");
            }
            processed = cipher.decrypt(processed);
            decryptionOperations.increment();
        }
        if (metadata.isCompressed()) {
            try {
                processed = metadata.getAlgorithm().decompress(processed);
            } catch (CorruptRecordException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new CorruptRecordException("Decompression with " + metadata.getAlgorithm() + " failed", e);
            }
        }
        if (processed.length != metadata.getOriginalSize()) {
            throw new CorruptRecordException("Decoded length " + processed.length
                + " does not match original size " + metadata.getOriginalSize());
        }
        try {
            JsonNode node = mapper.readTree(processed);
            if (node == null || node.isMissingNode()) {
                throw new CorruptRecordException("Payload contains no JSON value");
            }
            return node;
        } catch (IOException e) {
            throw new CorruptRecordException("Payload is not valid JSON", e);
        }
    }

    /**
     * Decide whether a payload of the given size is worth compressing.
     */
    public boolean shouldCompress(int size, ResourcePolicy policy) {
        if (size > compressionThreshold) {
            return true;
        }
        if (policy.isForceCompression()) {
            return true;
        }
        return size > SMALL_PAYLOAD_BYTES && policy.getNetworkQuality() != NetworkQuality.GOOD;
    }

    /**
     * Pick the compression algorithm for a payload.
     * LZ77 for large payloads or MAXIMUM mode, run-length for medium payloads or
     * AGGRESSIVE mode, dictionary substitution otherwise.
     */
    public static CompressionAlgorithm chooseAlgorithm(int size, ResourcePolicy policy) {
        CompressionMode mode = policy.getCompressionMode();
        if (mode == CompressionMode.MAXIMUM || size > LARGE_PAYLOAD_BYTES) {
            return CompressionAlgorithm.LZ77;
        }
        if (mode == CompressionMode.AGGRESSIVE || size > MEDIUM_PAYLOAD_BYTES) {
            return CompressionAlgorithm.SIMPLE;
        }
        return CompressionAlgorithm.FAST;
    }

    public byte[] serialize(JsonNode value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be serialized to JSON", e);
        }
    }

    public boolean isEncryptionAvailable() {
        return cipher != null;
    }

    public long getCompressionOperations() {
        return compressionOperations.sum();
    }

    /**
     * Number of attempts whose output was discarded for saving too little.
     */
    public long getCompressionRejected() {
        return compressionRejected.sum();
    }

    public long getBytesSaved() {
        return bytesSaved.sum();
    }

    public double getAverageRatio() {
        long ops = compressionOperations.sum();
        return ops > 0 ? ratioSum.sum() / ops : 0.0;
    }

    public long getEncryptionOperations() {
        return encryptionOperations.sum();
    }

    public long getDecryptionOperations() {
        return decryptionOperations.sum();
    }
}
