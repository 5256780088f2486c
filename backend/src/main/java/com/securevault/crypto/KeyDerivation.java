package com.securevault.crypto;

import org.bouncycastle.crypto.PBEParametersGenerator;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * PBKDF2-HMAC-SHA256 key derivation: passphrase + 16-byte salt -> 256-bit key.
 *
 * <p>The passphrase is fed as UTF-8, which keeps keys compatible with blobs
 * produced by WebCrypto's PBKDF2. The instance is stateless and thread-safe.
 */
public class KeyDerivation {

    public static final int MIN_ITERATIONS = 100_000;
    public static final int KEY_SIZE_BITS = 256;

    private final int iterations;

    public KeyDerivation(int iterations) {
        if (iterations < MIN_ITERATIONS) {
            throw new IllegalArgumentException(
                    "PBKDF2 iterations must be at least " + MIN_ITERATIONS + ", got " + iterations);
        }
        this.iterations = iterations;
    }

    public int getIterations() {
        return iterations;
    }

    public byte[] deriveKey(String passphrase, byte[] salt) {
        return deriveKey(passphrase, salt, iterations);
    }

    /**
     * Derives with an explicit work factor, used when re-checking a value that
     * recorded its own iteration count.
     */
    public byte[] deriveKey(String passphrase, byte[] salt, int iterationCount) {
        if (passphrase == null) {
            throw new IllegalArgumentException("passphrase is required");
        }
        if (salt == null || salt.length != EncryptedBlob.SALT_SIZE) {
            throw new IllegalArgumentException("salt must be " + EncryptedBlob.SALT_SIZE + " bytes");
        }
        if (iterationCount < MIN_ITERATIONS) {
            throw new IllegalArgumentException("PBKDF2 iterations below " + MIN_ITERATIONS);
        }

        PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
        generator.init(
                PBEParametersGenerator.PKCS5PasswordToUTF8Bytes(passphrase.toCharArray()),
                salt,
                iterationCount);
        KeyParameter key = (KeyParameter) generator.generateDerivedParameters(KEY_SIZE_BITS);
        return key.getKey();
    }
}
