package com.securevault.config;

import com.securevault.crypto.CommitmentScheme;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * {@code securevault.*} settings.
 *
 * @param storage              where the vault keys live
 * @param kdfIterations        PBKDF2 work factor, never below 100,000
 * @param commitmentScheme     how the commitment of a new vault is computed
 * @param sessionTtl           lifetime of an unlocked session
 * @param sessionSweepInterval how often expired sessions are purged
 * @param bulkTimeout          upper bound for a whole {@code listDecrypted}
 * @param staleAfter           age after which the audit flags a record
 */
@ConfigurationProperties(prefix = "securevault")
public record VaultProps(
        @DefaultValue("cassandra") StorageType storage,
        @DefaultValue("100000") int kdfIterations,
        @DefaultValue("sha256") CommitmentScheme commitmentScheme,
        @DefaultValue("15m") Duration sessionTtl,
        @DefaultValue("1m") Duration sessionSweepInterval,
        @DefaultValue("30s") Duration bulkTimeout,
        @DefaultValue("90d") Duration staleAfter
) {
}
