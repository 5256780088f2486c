package com.securevault.config;

import com.securevault.crypto.CommitmentScheme;
import com.securevault.crypto.PassphraseCommitment;
import com.securevault.vault.VaultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Logs the vault state once the application is up, and flags the weak
 * commitment scheme when it is in use.
 */
public class VaultStartupReport implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(VaultStartupReport.class);

    private final VaultStore vaultStore;
    private final PassphraseCommitment commitment;

    public VaultStartupReport(VaultStore vaultStore, PassphraseCommitment commitment) {
        this.vaultStore = vaultStore;
        this.commitment = commitment;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (commitment.getScheme() == CommitmentScheme.SHA256) {
            log.warn("Master key commitment uses unsalted SHA-256, which is much cheaper to brute-force "
                    + "than the PBKDF2 record encryption. Set securevault.commitment-scheme=pbkdf2 to harden "
                    + "new vaults.");
        }
        vaultStore.state()
                .doOnNext(state -> log.info("Vault state at startup: {}", state))
                .onErrorResume(e -> {
                    log.warn("Could not read vault state at startup: {}", e.getMessage());
                    return Mono.empty();
                })
                .block(Duration.ofSeconds(30));
    }
}
