package com.securevault.storage;

import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Map;

/**
 * Durable key-value surface the vault persists into.
 *
 * <p>The vault uses exactly two keys: the passphrase commitment and the
 * encrypted record collection. Implementations must be thread-safe, and
 * {@link #setAll} / {@link #deleteAll} must be atomic: after a crash either
 * every key was written (or removed) or none was.
 */
public interface VaultKeyValueStore {

    /** Emits the stored bytes, or completes empty when the key is absent. */
    Mono<byte[]> get(String key);

    Mono<Void> set(String key, byte[] value);

    /** Removing an absent key is not an error. */
    Mono<Void> delete(String key);

    Mono<Void> setAll(Map<String, byte[]> entries);

    Mono<Void> deleteAll(Collection<String> keys);
}
