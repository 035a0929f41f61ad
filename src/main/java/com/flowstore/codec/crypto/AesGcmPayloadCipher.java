package com.flowstore.codec.crypto;

import com.flowstore.codec.DecryptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * AES-256-GCM payload cipher with a daily rotating sub-key.
 *
 * Envelope layout:
 * - 1 byte: format version
 * - 4 bytes: epoch day the sub-key was derived for
 * - 12 bytes: IV
 * - N bytes: ciphertext followed by the 16-byte GCM tag
 *
 * The version and day bytes are authenticated as associated data. The sub-key is
 * HMAC-SHA256(SHA-256(masterKey), "flowstore-rotation:" + day), so a payload
 * written on one day decrypts on any later day.
 */
public class AesGcmPayloadCipher implements PayloadCipher {

    private static final Logger logger = LoggerFactory.getLogger(AesGcmPayloadCipher.class);

    private static final byte FORMAT_VERSION = 1;
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int IV_LENGTH = 12;
    private static final int TAG_BITS = 128;
    private static final int HEADER_LENGTH = 1 + 4;
    private static final int MIN_LENGTH = HEADER_LENGTH + IV_LENGTH + TAG_BITS / 8;

    private final SecretKeySpec masterKey;
    private final Clock clock;
    private final SecureRandom random;
    private final Map<Integer, SecretKeySpec> subKeys;

    /**
     * Create a cipher using the system clock for key rotation.
     *
     * @param masterKey the configured encryption key material
     */
    public AesGcmPayloadCipher(String masterKey) {
        this(masterKey, Clock.systemUTC());
    }

    /**
     * Create a cipher with an explicit clock.
     *
     * @param masterKey the configured encryption key material
     * @param clock     clock used to pick the rotation day when encrypting
     */
    public AesGcmPayloadCipher(String masterKey, Clock clock) {
        if (masterKey == null || masterKey.isEmpty()) {
            throw new IllegalArgumentException("Encryption key cannot be null or empty");
        }
        this.masterKey = new SecretKeySpec(sha256(masterKey.getBytes(StandardCharsets.UTF_8)), HMAC_ALGORITHM);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = new SecureRandom();
        this.subKeys = new ConcurrentHashMap<>();
    }

    @Override
    public byte[] encrypt(byte[] plaintext) {
        int day = (int) LocalDate.now(clock).toEpochDay();
        byte[] iv = new byte[IV_LENGTH];
        random.nextBytes(iv);
        byte[] header = header(day);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, subKey(day), new GCMParameterSpec(TAG_BITS, iv));
            cipher.updateAAD(header);
            byte[] sealed = cipher.doFinal(plaintext);
            return ByteBuffer.allocate(header.length + iv.length + sealed.length)
                .put(header)
                .put(iv)
                .put(sealed)
                .array();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Payload encryption failed", e);
        }
    }

    @Override
    public byte[] decrypt(byte[] ciphertext) {
        if (ciphertext == null || ciphertext.length < MIN_LENGTH) {
            throw new DecryptionException("Ciphertext too short: "
                + (ciphertext == null ? 0 : ciphertext.length) + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.wrap(ciphertext);
        byte version = buffer.get();
        if (version != FORMAT_VERSION) {
            throw new DecryptionException("Unsupported ciphertext format version " + version);
        }
        int day = buffer.getInt();
        byte[] iv = new byte[IV_LENGTH];
        buffer.get(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, subKey(day), new GCMParameterSpec(TAG_BITS, iv));
            cipher.updateAAD(ciphertext, 0, HEADER_LENGTH);
            return cipher.doFinal(ciphertext, HEADER_LENGTH + IV_LENGTH,
                ciphertext.length - HEADER_LENGTH - IV_LENGTH);
        } catch (AEADBadTagException e) {
            throw new DecryptionException("Ciphertext failed authentication (tampered or wrong key)", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Payload decryption failed", e);
        }
    }

    /**
     * Number of distinct rotation days a sub-key has been derived for.
     */
    public int getDerivedKeyCount() {
        return subKeys.size();
    }

    private SecretKeySpec subKey(int day) {
        return subKeys.computeIfAbsent(day, d -> {
            logger.debug("Deriving payload sub-key for epoch day {}", d);
            return new SecretKeySpec(hmac(("flowstore-rotation:" + d).getBytes(StandardCharsets.UTF_8)), "AES");
        });
    }

    private byte[] hmac(byte[] data) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(masterKey);
            return mac.doFinal(data);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Sub-key derivation failed", e);
        }
    }

    private static byte[] header(int day) {
        return ByteBuffer.allocate(HEADER_LENGTH).put(FORMAT_VERSION).putInt(day).array();
    }

    private static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
