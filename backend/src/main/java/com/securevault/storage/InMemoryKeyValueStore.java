package com.securevault.storage;

import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Nothing survives a restart; used by the {@code memory}
 * storage mode and by tests.
 */
public class InMemoryKeyValueStore implements VaultKeyValueStore {

    private final ConcurrentHashMap<String, byte[]> entries = new ConcurrentHashMap<>();

    @Override
    public Mono<byte[]> get(String key) {
        return Mono.fromSupplier(() -> {
            byte[] value = entries.get(key);
            return value == null ? null : value.clone();
        });
    }

    @Override
    public Mono<Void> set(String key, byte[] value) {
        return Mono.fromRunnable(() -> {
            synchronized (entries) {
                entries.put(key, value.clone());
            }
        });
    }

    @Override
    public Mono<Void> delete(String key) {
        return Mono.fromRunnable(() -> {
            synchronized (entries) {
                entries.remove(key);
            }
        });
    }

    @Override
    public Mono<Void> setAll(Map<String, byte[]> values) {
        return Mono.fromRunnable(() -> {
            synchronized (entries) {
                values.forEach((key, value) -> entries.put(key, value.clone()));
            }
        });
    }

    @Override
    public Mono<Void> deleteAll(Collection<String> keys) {
        return Mono.fromRunnable(() -> {
            synchronized (entries) {
                keys.forEach(entries::remove);
            }
        });
    }
}
