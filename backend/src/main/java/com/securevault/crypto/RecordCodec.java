package com.securevault.crypto;

import com.securevault.error.VaultFormatException;

import java.util.Arrays;
import java.util.Base64;

/**
 * Packs an {@link EncryptedBlob} into the transport string
 * {@code base64(salt || iv || ciphertext+tag)} and back. Knows the byte layout
 * only; never touches keys.
 */
public class RecordCodec {

    public String encode(EncryptedBlob blob) {
        byte[] packed = new byte[blob.packedSize()];
        System.arraycopy(blob.salt(), 0, packed, 0, EncryptedBlob.SALT_SIZE);
        System.arraycopy(blob.iv(), 0, packed, EncryptedBlob.SALT_SIZE, EncryptedBlob.IV_SIZE);
        System.arraycopy(blob.ciphertext(), 0, packed, EncryptedBlob.MIN_PACKED_SIZE, blob.ciphertext().length);
        return Base64.getEncoder().encodeToString(packed);
    }

    public EncryptedBlob decode(String transport) {
        if (transport == null) {
            throw new VaultFormatException("Encrypted payload is missing");
        }
        byte[] packed;
        try {
            packed = Base64.getDecoder().decode(transport.trim());
        } catch (IllegalArgumentException e) {
            throw new VaultFormatException("Encrypted payload is not valid base64", e);
        }
        if (packed.length < EncryptedBlob.MIN_PACKED_SIZE) {
            throw new VaultFormatException("Encrypted payload too short: " + packed.length + " bytes");
        }
        return new EncryptedBlob(
                Arrays.copyOfRange(packed, 0, EncryptedBlob.SALT_SIZE),
                Arrays.copyOfRange(packed, EncryptedBlob.SALT_SIZE, EncryptedBlob.MIN_PACKED_SIZE),
                Arrays.copyOfRange(packed, EncryptedBlob.MIN_PACKED_SIZE, packed.length));
    }
}
