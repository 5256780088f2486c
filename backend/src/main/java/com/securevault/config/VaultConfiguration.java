package com.securevault.config;

import com.securevault.crypto.AuthenticatedCipher;
import com.securevault.crypto.KeyDerivation;
import com.securevault.crypto.PassphraseCommitment;
import com.securevault.crypto.RecordCodec;
import com.securevault.crypto.SecretSealer;
import com.securevault.session.VaultSessionManager;
import com.securevault.storage.CassandraKeyValueStore;
import com.securevault.storage.InMemoryKeyValueStore;
import com.securevault.storage.VaultEntryRepository;
import com.securevault.storage.VaultKeyValueStore;
import com.securevault.vault.RecordCollectionCodec;
import com.securevault.vault.VaultAudit;
import com.securevault.vault.VaultStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.cassandra.core.ReactiveCassandraOperations;
import org.springframework.scheduling.annotation.SchedulingConfigurer;

import java.security.SecureRandom;
import java.time.Clock;

@Configuration
public class VaultConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    // --- Crypto ---

    @Bean
    public KeyDerivation keyDerivation(VaultProps props) {
        return new KeyDerivation(props.kdfIterations());
    }

    @Bean
    public AuthenticatedCipher authenticatedCipher() {
        return new AuthenticatedCipher();
    }

    @Bean
    public RecordCodec recordCodec() {
        return new RecordCodec();
    }

    @Bean
    public SecretSealer secretSealer(KeyDerivation keyDerivation, AuthenticatedCipher cipher,
                                     RecordCodec codec, SecureRandom secureRandom) {
        return new SecretSealer(keyDerivation, cipher, codec, secureRandom);
    }

    @Bean
    public PassphraseCommitment passphraseCommitment(VaultProps props, KeyDerivation keyDerivation,
                                                     SecureRandom secureRandom) {
        return new PassphraseCommitment(props.commitmentScheme(), keyDerivation, secureRandom);
    }

    // --- Storage ---

    @Bean
    @ConditionalOnProperty(prefix = "securevault", name = "storage", havingValue = "memory")
    public VaultKeyValueStore inMemoryKeyValueStore() {
        return new InMemoryKeyValueStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "securevault", name = "storage", havingValue = "cassandra", matchIfMissing = true)
    public VaultKeyValueStore cassandraKeyValueStore(VaultEntryRepository repository,
                                                     ReactiveCassandraOperations operations,
                                                     Clock clock) {
        return new CassandraKeyValueStore(repository, operations, clock);
    }

    // --- Vault ---

    @Bean
    public RecordCollectionCodec recordCollectionCodec(RecordCodec codec) {
        return new RecordCollectionCodec(codec);
    }

    @Bean
    public VaultStore vaultStore(VaultKeyValueStore storage, SecretSealer sealer,
                                 PassphraseCommitment commitment, RecordCollectionCodec collectionCodec,
                                 Clock clock, VaultProps props) {
        return new VaultStore(storage, sealer, commitment, collectionCodec, clock, props.bulkTimeout());
    }

    @Bean
    public VaultSessionManager vaultSessionManager(VaultStore vaultStore, Clock clock, VaultProps props) {
        return new VaultSessionManager(vaultStore, clock, props.sessionTtl());
    }

    @Bean
    public SchedulingConfigurer sessionSweep(VaultSessionManager sessions, VaultProps props) {
        return registrar -> registrar.addFixedDelayTask(sessions::purgeExpired, props.sessionSweepInterval());
    }

    @Bean
    public VaultAudit vaultAudit(Clock clock, VaultProps props) {
        return new VaultAudit(clock, props.staleAfter());
    }

    @Bean
    public VaultStartupReport vaultStartupReport(VaultStore vaultStore, PassphraseCommitment commitment) {
        return new VaultStartupReport(vaultStore, commitment);
    }
}
