package com.securevault.crypto;

/**
 * The three parts of one sealed secret, in their on-disk order:
 * {@code salt(16) || iv(12) || ciphertext+tag}.
 *
 * <p>Arrays are held as given; callers must not mutate them after construction.
 */
public record EncryptedBlob(byte[] salt, byte[] iv, byte[] ciphertext) {

    public static final int SALT_SIZE = 16;
    public static final int IV_SIZE = 12;

    /** Anything shorter cannot even hold the salt and the IV. */
    public static final int MIN_PACKED_SIZE = SALT_SIZE + IV_SIZE;

    public EncryptedBlob {
        if (salt == null || salt.length != SALT_SIZE) {
            throw new IllegalArgumentException("salt must be " + SALT_SIZE + " bytes");
        }
        if (iv == null || iv.length != IV_SIZE) {
            throw new IllegalArgumentException("iv must be " + IV_SIZE + " bytes");
        }
        if (ciphertext == null) {
            throw new IllegalArgumentException("ciphertext is required");
        }
    }

    public int packedSize() {
        return SALT_SIZE + IV_SIZE + ciphertext.length;
    }
}
