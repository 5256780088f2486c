package com.securevault.storage;

import org.springframework.data.cassandra.core.ReactiveCassandraOperations;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * {@link VaultKeyValueStore} on the {@code vault_entries} table.
 *
 * <p>Single-key operations go through the reactive repository. Multi-key
 * writes use a LOGGED batch, which Cassandra applies atomically, so the
 * commitment and the record collection are created and wiped together.
 */
public class CassandraKeyValueStore implements VaultKeyValueStore {

    private final VaultEntryRepository repository;
    private final ReactiveCassandraOperations operations;
    private final Clock clock;

    public CassandraKeyValueStore(VaultEntryRepository repository,
                                  ReactiveCassandraOperations operations,
                                  Clock clock) {
        this.repository = repository;
        this.operations = operations;
        this.clock = clock;
    }

    @Override
    public Mono<byte[]> get(String key) {
        return repository.findById(key).map(VaultEntry::valueBytes);
    }

    @Override
    public Mono<Void> set(String key, byte[] value) {
        return repository.save(new VaultEntry(key, value, clock.instant())).then();
    }

    @Override
    public Mono<Void> delete(String key) {
        return repository.deleteById(key);
    }

    @Override
    public Mono<Void> setAll(Map<String, byte[]> entries) {
        Instant now = clock.instant();
        List<VaultEntry> rows = entries.entrySet().stream()
                .map(e -> new VaultEntry(e.getKey(), e.getValue(), now))
                .toList();
        return operations.batchOps().insert(rows).execute().then();
    }

    @Override
    public Mono<Void> deleteAll(Collection<String> keys) {
        List<VaultEntry> rows = keys.stream()
                .map(key -> new VaultEntry(key, null, null))
                .toList();
        return operations.batchOps().delete(rows).execute().then();
    }
}
