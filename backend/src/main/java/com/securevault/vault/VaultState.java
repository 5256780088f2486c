package com.securevault.vault;

/**
 * Vault lifecycle:
 * {@code UNINITIALIZED -> initialize -> LOCKED -> unlock -> UNLOCKED -> logout/timeout -> LOCKED}.
 * Only an explicit wipe goes back to {@code UNINITIALIZED}.
 */
public enum VaultState {
    UNINITIALIZED,
    LOCKED,
    UNLOCKED
}
