package com.securevault.crypto;

/**
 * How the vault commitment is computed for new vaults. Stored commitments of
 * either kind are always recognised on verification.
 */
public enum CommitmentScheme {

    /** base64(SHA-256(passphrase)). Fast and unsalted. */
    SHA256,

    /** Salted PBKDF2-HMAC-SHA256 with the record-encryption work factor. */
    PBKDF2
}
