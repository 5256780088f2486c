package com.securevault.session;

import com.securevault.error.VaultStateException;
import com.securevault.vault.VaultState;
import com.securevault.vault.VaultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Unlock / resume / logout for the vault.
 *
 * <p>A successful unlock caches the verified passphrase in memory under a
 * random token for {@code ttl}. Nothing here is ever written to durable
 * storage, and the passphrase is never used as a key. Every failure reports
 * the same generic message, so callers cannot tell a wrong passphrase from a
 * missing vault.
 */
public class VaultSessionManager {

    static final String INVALID_MASTER_KEY = "Invalid master key";
    static final String LOCKED = "Vault is locked";

    private static final Logger log = LoggerFactory.getLogger(VaultSessionManager.class);

    private final VaultStore vaultStore;
    private final Clock clock;
    private final Duration ttl;

    // In-memory session cache, token -> session. Never persisted.
    private final ConcurrentHashMap<String, VaultSession> activeSessions = new ConcurrentHashMap<>();

    public VaultSessionManager(VaultStore vaultStore, Clock clock, Duration ttl) {
        this.vaultStore = vaultStore;
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * Verifies {@code passphrase} against the vault commitment and opens a
     * session for it.
     */
    public Mono<VaultSession> unlock(String passphrase) {
        return vaultStore.verify(passphrase)
                .flatMap(valid -> {
                    if (!valid) {
                        return Mono.<VaultSession>error(new VaultStateException(INVALID_MASTER_KEY));
                    }
                    purgeExpired();
                    Instant now = clock.instant();
                    VaultSession session = new VaultSession(
                            UUID.randomUUID().toString(), passphrase, now, now.plus(ttl));
                    activeSessions.put(session.getToken(), session);
                    log.info("Vault unlocked, {} active session(s)", activeSessions.size());
                    return Mono.just(session);
                });
    }

    /**
     * Restores the session behind {@code token}. The cached passphrase must
     * still match the commitment and still open the first stored record; if
     * either check fails the session is discarded and the vault is locked.
     */
    public Mono<VaultSession> resume(String token) {
        VaultSession session = token == null ? null : activeSessions.get(token);
        if (session == null) {
            return Mono.error(new VaultStateException(LOCKED));
        }
        if (session.isExpired(clock.instant())) {
            activeSessions.remove(token, session);
            log.info("Session expired");
            return Mono.error(new VaultStateException(LOCKED));
        }

        String passphrase = session.getPassphrase();
        return vaultStore.verify(passphrase)
                .flatMap(valid -> valid ? vaultStore.canDecrypt(passphrase) : Mono.just(false))
                .onErrorResume(e -> {
                    log.warn("Session restore check failed: {}", e.getClass().getSimpleName());
                    return Mono.just(false);
                })
                .flatMap(restorable -> {
                    if (restorable) {
                        return Mono.just(session);
                    }
                    activeSessions.remove(token, session);
                    log.warn("Discarded a session that can no longer decrypt the vault");
                    return Mono.<VaultSession>error(new VaultStateException(LOCKED));
                });
    }

    public Mono<Void> logout(String token) {
        return Mono.fromRunnable(() -> {
            if (token != null && activeSessions.remove(token) != null) {
                log.info("Vault session closed");
            }
        });
    }

    public void revokeAll() {
        int revoked = activeSessions.size();
        activeSessions.clear();
        if (revoked > 0) {
            log.info("Revoked {} vault session(s)", revoked);
        }
    }

    /** Wipes the vault and drops every session that pointed at it. */
    public Mono<Void> wipeVault() {
        return vaultStore.wipe().then(Mono.fromRunnable(this::revokeAll));
    }

    /**
     * {@code UNINITIALIZED} without a vault, {@code UNLOCKED} while a live
     * session exists, {@code LOCKED} otherwise.
     */
    public Mono<VaultState> state() {
        return vaultStore.state().map(state -> {
            if (state == VaultState.LOCKED && hasLiveSession()) {
                return VaultState.UNLOCKED;
            }
            return state;
        });
    }

    public int activeSessionCount() {
        return activeSessions.size();
    }

    /** Drops expired sessions; also run periodically by the session sweep task. */
    public void purgeExpired() {
        Instant now = clock.instant();
        activeSessions.values().removeIf(session -> session.isExpired(now));
    }

    private boolean hasLiveSession() {
        Instant now = clock.instant();
        return activeSessions.values().stream().anyMatch(session -> !session.isExpired(now));
    }
}
