package com.securevault.vault;

import com.securevault.crypto.PassphraseCommitment;
import com.securevault.crypto.SecretSealer;
import com.securevault.error.RecordNotFoundException;
import com.securevault.error.VaultFormatException;
import com.securevault.error.VaultIntegrityException;
import com.securevault.error.VaultStateException;
import com.securevault.storage.VaultKeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

/**
 * The encrypted vault: an ordered collection of records plus the passphrase
 * commitment, kept under two keys of a {@link VaultKeyValueStore}.
 *
 * <p><strong>Secrecy contract:</strong> the passphrase and every derived key
 * live only for the duration of a call. Each record's password is sealed with
 * its own fresh salt and IV, so records decrypt independently of each other.
 *
 * <p><strong>Partial-failure contract:</strong> {@link #listDecrypted} never
 * fails because of one bad record. Undecryptable records are left out of the
 * result and reported in {@link VaultListing#skipped()}.
 *
 * <p>Every read-modify-write of the collection holds a single-permit semaphore,
 * so concurrent mutations cannot lose updates.
 */
public class VaultStore {

    public static final String COMMITMENT_KEY = "securevault_master_hash";
    public static final String COLLECTION_KEY = "securevault_data";

    private static final Logger log = LoggerFactory.getLogger(VaultStore.class);

    private final VaultKeyValueStore storage;
    private final SecretSealer sealer;
    private final PassphraseCommitment commitment;
    private final RecordCollectionCodec collectionCodec;
    private final Clock clock;
    private final Duration bulkTimeout;

    private final Semaphore writeLock = new Semaphore(1, true);

    public VaultStore(VaultKeyValueStore storage,
                      SecretSealer sealer,
                      PassphraseCommitment commitment,
                      RecordCollectionCodec collectionCodec,
                      Clock clock,
                      Duration bulkTimeout) {
        this.storage = storage;
        this.sealer = sealer;
        this.commitment = commitment;
        this.collectionCodec = collectionCodec;
        this.clock = clock;
        this.bulkTimeout = bulkTimeout;
    }

    // ─── Lifecycle ───────────────────────────────────────────────────────────

    /**
     * Creates an empty vault protected by {@code passphrase}. The commitment and
     * the empty collection are written in one atomic multi-key write.
     */
    public Mono<Void> initialize(String passphrase) {
        if (passphrase == null || passphrase.isBlank()) {
            return Mono.error(new IllegalArgumentException("Master key is required"));
        }
        return exclusively(() -> exists()
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.<Void>error(new VaultStateException("Vault already exists"));
                    }
                    return Mono.fromCallable(() -> commitment.commit(passphrase))
                            .subscribeOn(Schedulers.parallel())
                            .flatMap(value -> storage.setAll(Map.of(
                                    COMMITMENT_KEY, value.getBytes(StandardCharsets.UTF_8),
                                    COLLECTION_KEY, collectionCodec.write(List.of()))));
                }))
                .doOnSuccess(ignored -> log.info("Vault initialized (commitment scheme {})", commitment.getScheme()));
    }

    /**
     * Checks {@code passphrase} against the stored commitment. Emits
     * {@code false} for a wrong passphrase, a missing vault, a damaged
     * commitment or a storage failure alike; never errors.
     */
    public Mono<Boolean> verify(String passphrase) {
        if (passphrase == null || passphrase.isEmpty()) {
            return Mono.just(false);
        }
        return storage.get(COMMITMENT_KEY)
                .publishOn(Schedulers.parallel())
                .map(stored -> commitment.matches(passphrase, new String(stored, StandardCharsets.UTF_8)))
                // no vault: still pay for one commitment so timing stays flat
                .switchIfEmpty(Mono.fromCallable(() -> {
                    commitment.commit(passphrase);
                    return false;
                }).subscribeOn(Schedulers.parallel()))
                .onErrorResume(e -> {
                    log.warn("Passphrase verification could not complete: {}", e.getClass().getSimpleName());
                    return Mono.just(false);
                });
    }

    /** True once either vault key exists; the original's {@code hasVault}. */
    public Mono<Boolean> exists() {
        return Mono.zip(
                        storage.get(COMMITMENT_KEY).hasElement(),
                        storage.get(COLLECTION_KEY).hasElement())
                .map(present -> present.getT1() || present.getT2());
    }

    /**
     * Storage-level state: {@code UNINITIALIZED} or {@code LOCKED}. Whether the
     * vault is unlocked is a session concern.
     */
    public Mono<VaultState> state() {
        return exists().map(exists -> exists ? VaultState.LOCKED : VaultState.UNINITIALIZED);
    }

    /** Destroys the vault. Both keys go in one atomic delete. */
    public Mono<Void> wipe() {
        return exclusively(() -> storage.deleteAll(List.of(COMMITMENT_KEY, COLLECTION_KEY)))
                .doOnSuccess(ignored -> log.warn("Vault wiped"));
    }

    // ─── Records ─────────────────────────────────────────────────────────────

    /**
     * Seals {@code secret} under a fresh salt and IV and appends a new record.
     *
     * @return the new record id
     */
    public Mono<String> addRecord(RecordMetadata metadata, String secret, String passphrase) {
        if (metadata == null) {
            return Mono.error(new IllegalArgumentException("metadata is required"));
        }
        if (secret == null || secret.isEmpty()) {
            return Mono.error(new IllegalArgumentException("password is required"));
        }
        // sealing is CPU bound and needs no lock
        return seal(secret, passphrase)
                .flatMap(encrypted -> exclusively(() -> requireRecords().flatMap(records -> {
                    Instant now = now();
                    VaultRecord record = new VaultRecord(
                            UUID.randomUUID().toString(),
                            metadata.website(),
                            metadata.username(),
                            encrypted,
                            metadata.url(),
                            metadata.category(),
                            metadata.notes(),
                            now,
                            now);
                    List<VaultRecord> updated = new ArrayList<>(records);
                    updated.add(record);
                    return persist(updated).thenReturn(record.id());
                })))
                .doOnNext(id -> log.debug("Added record {}", id));
    }

    /**
     * Opens every record with a key derived from its own salt. Records that do
     * not open are skipped and reported; the listing as a whole fails only on
     * a storage or collection-level error, or when the bulk timeout elapses.
     */
    public Mono<VaultListing> listDecrypted(String passphrase) {
        if (passphrase == null) {
            return Mono.error(new IllegalArgumentException("Master key is required"));
        }
        return loadRecords()
                .flatMap(records -> Flux.fromIterable(records)
                        .flatMapSequential(record -> Mono.fromCallable(() -> open(record, passphrase))
                                .subscribeOn(Schedulers.parallel()))
                        .collectList()
                        .map(attempts -> toListing(records.size(), attempts)))
                .timeout(bulkTimeout);
    }

    /**
     * Applies {@code patch} to record {@code id}. A new password is sealed with
     * fresh randomness; {@code lastModified} always moves forward.
     */
    public Mono<VaultRecord> updateRecord(String id, RecordPatch patch, String passphrase) {
        RecordPatch changes = patch == null ? RecordPatch.empty() : patch;
        Mono<Optional<String>> resealed = changes.changesPassword()
                ? seal(changes.password(), passphrase).map(Optional::of)
                : Mono.just(Optional.empty());

        return resealed.flatMap(encrypted -> exclusively(() -> requireRecords().flatMap(records -> {
            int index = indexOf(records, id);
            if (index < 0) {
                return Mono.<VaultRecord>error(new RecordNotFoundException(id));
            }
            VaultRecord updated = applyPatch(records.get(index), changes, encrypted.orElse(null));
            List<VaultRecord> next = new ArrayList<>(records);
            next.set(index, updated);
            return persist(next).thenReturn(updated);
        }))).doOnNext(record -> log.debug("Updated record {}", record.id()));
    }

    /** Removes record {@code id}; removing an unknown id is a no-op. */
    public Mono<Void> deleteRecord(String id) {
        return exclusively(() -> requireRecords().flatMap(records -> {
            List<VaultRecord> remaining = records.stream()
                    .filter(record -> !record.id().equals(id))
                    .toList();
            if (remaining.size() == records.size()) {
                return Mono.<Void>empty();
            }
            log.debug("Deleted record {}", id);
            return persist(remaining);
        }));
    }

    /** Number of stored records, readable or not. */
    public Mono<Integer> count() {
        return loadRecords().map(List::size);
    }

    /**
     * Tries to open the first stored record with {@code passphrase}. An empty
     * vault passes. Used to check a cached session passphrase.
     */
    public Mono<Boolean> canDecrypt(String passphrase) {
        return loadRecords().flatMap(records -> {
            if (records.isEmpty()) {
                return Mono.just(true);
            }
            return Mono.fromCallable(() -> open(records.get(0), passphrase).decrypted() != null)
                    .subscribeOn(Schedulers.parallel());
        });
    }

    // ─── Export / import ─────────────────────────────────────────────────────

    /** The persisted collection, byte for byte. Nothing is decrypted. */
    public Mono<String> exportAll() {
        return storage.get(COLLECTION_KEY)
                .switchIfEmpty(Mono.error(() -> new VaultStateException("Vault is not initialized")))
                .map(bytes -> new String(bytes, StandardCharsets.UTF_8));
    }

    /**
     * Writes {@link #exportAll()} to {@code securevault-backup-<date>.json}
     * inside {@code directory}.
     */
    public Mono<Path> exportTo(Path directory) {
        return exportAll().flatMap(json -> Mono.fromCallable(() -> {
            LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
            Files.createDirectories(directory);
            Path file = directory.resolve("securevault-backup-" + today + ".json");
            Files.writeString(file, json, StandardCharsets.UTF_8);
            log.info("Exported vault backup to {}", file);
            return file;
        }).subscribeOn(Schedulers.boundedElastic()));
    }

    /**
     * Replaces the whole collection with {@code snapshot}. The snapshot is
     * validated completely before anything is written.
     *
     * @return the number of imported records
     */
    public Mono<Integer> importAll(String snapshot) {
        return Mono.fromCallable(() -> collectionCodec.readSnapshot(snapshot))
                // the old collection is replaced wholesale and may be unreadable, so it is not decoded
                .flatMap(records -> exclusively(() -> requireInitialized()
                        .then(persist(records))
                        .thenReturn(records.size())))
                .doOnNext(count -> log.info("Imported {} records", count));
    }

    // ─── Internals ───────────────────────────────────────────────────────────

    private Mono<String> seal(String secret, String passphrase) {
        if (passphrase == null || passphrase.isEmpty()) {
            return Mono.error(new IllegalArgumentException("Master key is required"));
        }
        return Mono.fromCallable(() -> sealer.seal(secret, passphrase))
                .subscribeOn(Schedulers.parallel());
    }

    private Attempt open(VaultRecord record, String passphrase) {
        try {
            return Attempt.opened(record.withPassword(sealer.open(record.encryptedPassword(), passphrase)));
        } catch (VaultFormatException e) {
            log.warn("Skipping record {}: malformed encrypted payload", record.id());
            return Attempt.failed(new SkippedRecord(record.id(), SkippedRecord.Reason.FORMAT));
        } catch (VaultIntegrityException e) {
            log.warn("Skipping record {}: authentication failed", record.id());
            return Attempt.failed(new SkippedRecord(record.id(), SkippedRecord.Reason.INTEGRITY));
        }
    }

    private static VaultListing toListing(int storedCount, List<Attempt> attempts) {
        List<DecryptedRecord> records = new ArrayList<>(attempts.size());
        List<SkippedRecord> skipped = new ArrayList<>();
        for (Attempt attempt : attempts) {
            if (attempt.decrypted() != null) {
                records.add(attempt.decrypted());
            } else {
                skipped.add(attempt.skipped());
            }
        }
        if (!skipped.isEmpty()) {
            log.warn("{} of {} records could not be decrypted", skipped.size(), storedCount);
        }
        return new VaultListing(records, storedCount, skipped);
    }

    private VaultRecord applyPatch(VaultRecord current, RecordPatch patch, String encryptedPassword) {
        Instant now = now();
        // lastModified is strictly monotonic per record
        if (!now.isAfter(current.lastModified())) {
            now = current.lastModified().plusMillis(1);
        }
        return new VaultRecord(
                current.id(),
                hasText(patch.website()) ? patch.website() : current.website(),
                hasText(patch.username()) ? patch.username() : current.username(),
                encryptedPassword != null ? encryptedPassword : current.encryptedPassword(),
                patch.url() != null ? patch.url() : current.url(),
                hasText(patch.category()) ? patch.category() : current.category(),
                patch.notes() != null ? patch.notes() : current.notes(),
                current.createdAt(),
                now);
    }

    private Mono<List<VaultRecord>> loadRecords() {
        return storage.get(COLLECTION_KEY)
                .map(collectionCodec::read)
                .defaultIfEmpty(List.of());
    }

    private Mono<List<VaultRecord>> requireRecords() {
        return storage.get(COLLECTION_KEY)
                .switchIfEmpty(Mono.error(() -> new VaultStateException("Vault is not initialized")))
                .map(collectionCodec::read);
    }

    private Mono<Void> requireInitialized() {
        return exists().flatMap(exists -> exists
                ? Mono.<Void>empty()
                : Mono.<Void>error(new VaultStateException("Vault is not initialized")));
    }

    private Mono<Void> persist(List<VaultRecord> records) {
        return storage.set(COLLECTION_KEY, collectionCodec.write(records));
    }

    /**
     * Runs {@code work} while holding the write permit. The permit is released
     * on completion, error and cancellation alike.
     */
    private <T> Mono<T> exclusively(Supplier<Mono<T>> work) {
        return Mono.usingWhen(
                Mono.fromCallable(() -> {
                    writeLock.acquire();
                    return writeLock;
                }).subscribeOn(Schedulers.boundedElastic()),
                permit -> work.get(),
                permit -> Mono.fromRunnable(permit::release));
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static int indexOf(List<VaultRecord> records, String id) {
        for (int i = 0; i < records.size(); i++) {
            if (records.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }

    private record Attempt(DecryptedRecord decrypted, SkippedRecord skipped) {

        static Attempt opened(DecryptedRecord record) {
            return new Attempt(record, null);
        }

        static Attempt failed(SkippedRecord record) {
            return new Attempt(null, record);
        }
    }
}
