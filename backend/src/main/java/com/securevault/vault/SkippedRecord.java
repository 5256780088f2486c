package com.securevault.vault;

/**
 * A stored record that {@link VaultStore#listDecrypted} could not open.
 */
public record SkippedRecord(String id, Reason reason) {

    public enum Reason {
        /** The stored blob is not valid base64 or is too short. */
        FORMAT,
        /** Tag mismatch: wrong passphrase or tampered blob. */
        INTEGRITY
    }
}
