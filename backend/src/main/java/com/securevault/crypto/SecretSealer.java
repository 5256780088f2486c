package com.securevault.crypto;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Seals a single secret string under a passphrase.
 *
 * <p>Each {@link #seal} mints a fresh salt and a fresh IV, so every blob gets
 * its own key and no (key, iv) pair is ever reused. {@link #open} re-derives
 * the key from the salt embedded in the blob itself.
 */
public class SecretSealer {

    private final KeyDerivation keyDerivation;
    private final AuthenticatedCipher cipher;
    private final RecordCodec codec;
    private final SecureRandom random;

    public SecretSealer(KeyDerivation keyDerivation, AuthenticatedCipher cipher,
                        RecordCodec codec, SecureRandom random) {
        this.keyDerivation = keyDerivation;
        this.cipher = cipher;
        this.codec = codec;
        this.random = random;
    }

    public String seal(String plaintext, String passphrase) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext is required");
        }
        byte[] salt = new byte[EncryptedBlob.SALT_SIZE];
        byte[] iv = new byte[EncryptedBlob.IV_SIZE];
        random.nextBytes(salt);
        random.nextBytes(iv);

        byte[] key = keyDerivation.deriveKey(passphrase, salt);
        try {
            byte[] ciphertext = cipher.encrypt(plaintext.getBytes(StandardCharsets.UTF_8), key, iv);
            return codec.encode(new EncryptedBlob(salt, iv, ciphertext));
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    /**
     * @throws com.securevault.error.VaultFormatException    malformed transport string
     * @throws com.securevault.error.VaultIntegrityException wrong passphrase or tampered blob
     */
    public String open(String transport, String passphrase) {
        EncryptedBlob blob = codec.decode(transport);
        byte[] key = keyDerivation.deriveKey(passphrase, blob.salt());
        try {
            byte[] plaintext = cipher.decrypt(blob.ciphertext(), key, blob.iv());
            return new String(plaintext, StandardCharsets.UTF_8);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }
}
