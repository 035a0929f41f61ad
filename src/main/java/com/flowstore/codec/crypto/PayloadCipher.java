package com.flowstore.codec.crypto;

import com.flowstore.codec.DecryptionException;

/**
 * Symmetric encryption of stored payloads.
 * Implementations must embed everything decryption needs besides the key
 * (IV, rotation input) in the returned ciphertext.
 */
public interface PayloadCipher {

    byte[] encrypt(byte[] plaintext);

    /**
     * @throws DecryptionException if the ciphertext is malformed, tampered with,
     *                             or was produced under a different key
     */
    byte[] decrypt(byte[] ciphertext);
}
