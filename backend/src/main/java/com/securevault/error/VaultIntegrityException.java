package com.securevault.error;

/**
 * AES-GCM authentication tag mismatch. Raised for tampered ciphertext and for a
 * wrong passphrase alike; the two cannot be told apart.
 */
public class VaultIntegrityException extends VaultException {

    public VaultIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
