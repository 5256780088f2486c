package com.securevault.storage;

import com.securevault.vault.DecryptedRecord;
import com.securevault.vault.RecordMetadata;
import com.securevault.vault.VaultStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledIfEnvironmentVariable;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.CassandraContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Storage integration tests against a real Cassandra container.
 *
 * Covers the key-value contract of the vault_entries table, the LOGGED batch
 * writes, and one vault round trip on top of them.
 *
 * Skipped when Docker is unavailable or SKIP_DB_TESTS is set.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@DisabledIfEnvironmentVariable(named = "SKIP_DB_TESTS", matches = "true")
class CassandraKeyValueStoreIntegrationTest {

    @SuppressWarnings("resource")
    @Container
    static CassandraContainer<?> cassandra =
            new CassandraContainer<>("cassandra:4.1")
                    .withInitScript("schema.cql");

    @DynamicPropertySource
    static void cassandraProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.cassandra.contact-points",
                () -> cassandra.getHost() + ":" + cassandra.getMappedPort(9042));
        registry.add("spring.cassandra.local-datacenter", () -> "datacenter1");
        registry.add("spring.cassandra.keyspace-name",    () -> "securevault");
        registry.add("securevault.storage",               () -> "cassandra");
    }

    @Autowired
    private VaultKeyValueStore store;

    @Autowired
    private VaultStore vaultStore;

    @BeforeEach
    void clean() {
        vaultStore.wipe().block();
        store.deleteAll(List.of("k1", "k2", "single")).block();
    }

    // ── Tests ─────────────────────────────────────────────────────────────────

    @Test
    void cassandraStoreIsSelected() {
        assertInstanceOf(CassandraKeyValueStore.class, store);
    }

    @Test
    void shouldSetGetAndDeleteSingleKey() {
        store.set("single", "value".getBytes(StandardCharsets.UTF_8)).block();

        StepVerifier.create(store.get("single"))
                .assertNext(bytes -> assertEquals("value", new String(bytes, StandardCharsets.UTF_8)))
                .verifyComplete();

        store.delete("single").block();
        StepVerifier.create(store.get("single")).verifyComplete();
    }

    @Test
    void batchWritesAndDeletesEveryKey() {
        store.setAll(Map.of("k1", new byte[]{1}, "k2", new byte[]{2})).block();

        StepVerifier.create(store.get("k1")).assertNext(b -> assertArrayEquals(new byte[]{1}, b)).verifyComplete();
        StepVerifier.create(store.get("k2")).assertNext(b -> assertArrayEquals(new byte[]{2}, b)).verifyComplete();

        store.deleteAll(List.of("k1", "k2")).block();

        StepVerifier.create(store.get("k1")).verifyComplete();
        StepVerifier.create(store.get("k2")).verifyComplete();
    }

    @Test
    void vaultRoundTripOnCassandra() {
        vaultStore.initialize("Tr0ub4dor&3").block();
        vaultStore.addRecord(RecordMetadata.of("github.com", "alice"), "s3cr3t!", "Tr0ub4dor&3").block();

        StepVerifier.create(vaultStore.verify("Tr0ub4dor&3")).expectNext(true).verifyComplete();
        StepVerifier.create(vaultStore.listDecrypted("Tr0ub4dor&3"))
                .assertNext(listing -> assertEquals(List.of("s3cr3t!"),
                        listing.records().stream().map(DecryptedRecord::password).toList()))
                .verifyComplete();
    }
}
