package com.securevault.crypto;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Computes and checks the one-way value stored to verify the master passphrase.
 *
 * <p>Two stored formats exist:
 * <ul>
 *   <li>{@code base64(SHA-256(passphrase))}, written by {@link CommitmentScheme#SHA256};</li>
 *   <li>{@code pbkdf2-sha256$<iterations>$<b64 salt>$<b64 hash>}, written by
 *       {@link CommitmentScheme#PBKDF2}.</li>
 * </ul>
 * {@link #matches} accepts both, whatever scheme is configured for new vaults.
 * Comparison is constant time and every malformed input simply does not match.
 */
public class PassphraseCommitment {

    static final String PBKDF2_PREFIX = "pbkdf2-sha256";

    /** Stored work factors above this multiple of the configured one are refused. */
    static final int MAX_ITERATION_FACTOR = 10;

    private final CommitmentScheme scheme;
    private final KeyDerivation keyDerivation;
    private final SecureRandom random;

    public PassphraseCommitment(CommitmentScheme scheme, KeyDerivation keyDerivation, SecureRandom random) {
        this.scheme = scheme;
        this.keyDerivation = keyDerivation;
        this.random = random;
    }

    public CommitmentScheme getScheme() {
        return scheme;
    }

    public String commit(String passphrase) {
        if (scheme == CommitmentScheme.PBKDF2) {
            byte[] salt = new byte[EncryptedBlob.SALT_SIZE];
            random.nextBytes(salt);
            int iterations = keyDerivation.getIterations();
            byte[] hash = keyDerivation.deriveKey(passphrase, salt, iterations);
            Base64.Encoder b64 = Base64.getEncoder();
            return PBKDF2_PREFIX + "$" + iterations + "$" + b64.encodeToString(salt) + "$" + b64.encodeToString(hash);
        }
        return Base64.getEncoder().encodeToString(sha256(passphrase));
    }

    public boolean matches(String passphrase, String stored) {
        if (passphrase == null || stored == null || stored.isBlank()) {
            return false;
        }
        try {
            if (stored.startsWith(PBKDF2_PREFIX + "$")) {
                return matchesPbkdf2(passphrase, stored);
            }
            byte[] expected = Base64.getDecoder().decode(stored.trim());
            return MessageDigest.isEqual(expected, sha256(passphrase));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private boolean matchesPbkdf2(String passphrase, String stored) {
        String[] parts = stored.split("\\$");
        if (parts.length != 4) {
            return false;
        }
        int iterations = Integer.parseInt(parts[1]);
        byte[] salt = Base64.getDecoder().decode(parts[2]);
        byte[] expected = Base64.getDecoder().decode(parts[3]);
        long ceiling = (long) keyDerivation.getIterations() * MAX_ITERATION_FACTOR;
        if (salt.length != EncryptedBlob.SALT_SIZE
                || iterations < KeyDerivation.MIN_ITERATIONS
                || iterations > ceiling) {
            return false;
        }
        return MessageDigest.isEqual(expected, keyDerivation.deriveKey(passphrase, salt, iterations));
    }

    private static byte[] sha256(String passphrase) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(passphrase.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
