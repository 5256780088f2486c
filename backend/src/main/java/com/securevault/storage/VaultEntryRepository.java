package com.securevault.storage;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface VaultEntryRepository extends ReactiveCassandraRepository<VaultEntry, String> {
    // Inherits: findById(entryKey), save(entry), deleteById(entryKey)
}
