package com.securevault.session;

import java.time.Instant;

/**
 * A verified passphrase held for one working session. Lives in memory only;
 * the token is random and unrelated to the passphrase.
 */
public final class VaultSession {

    private final String token;
    private final String passphrase;
    private final Instant createdAt;
    private final Instant expiresAt;

    VaultSession(String token, String passphrase, Instant createdAt, Instant expiresAt) {
        this.token = token;
        this.passphrase = passphrase;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    public String getToken() {
        return token;
    }

    /** The master key to hand to vault operations for the rest of the session. */
    public String getPassphrase() {
        return passphrase;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "VaultSession[createdAt=" + createdAt + ", expiresAt=" + expiresAt + "]";
    }
}
