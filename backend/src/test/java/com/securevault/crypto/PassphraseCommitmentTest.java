package com.securevault.crypto;

import com.securevault.support.VaultFixtures;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class PassphraseCommitmentTest {

    private final PassphraseCommitment sha256 =
            new PassphraseCommitment(CommitmentScheme.SHA256, VaultFixtures.keyDerivation(), VaultFixtures.RANDOM);
    private final PassphraseCommitment pbkdf2 =
            new PassphraseCommitment(CommitmentScheme.PBKDF2, VaultFixtures.keyDerivation(), VaultFixtures.RANDOM);

    @Test
    void sha256CommitmentIsBase64OfDigest() throws Exception {
        byte[] digest = MessageDigest.getInstance("SHA-256")
                .digest("Tr0ub4dor&3".getBytes(StandardCharsets.UTF_8));

        assertEquals(Base64.getEncoder().encodeToString(digest), sha256.commit("Tr0ub4dor&3"));
    }

    @Test
    void sha256CommitmentMatchesOnlyItsPassphrase() {
        String stored = sha256.commit("Tr0ub4dor&3");

        assertTrue(sha256.matches("Tr0ub4dor&3", stored));
        assertFalse(sha256.matches("tr0ub4dor&3", stored));
        assertFalse(sha256.matches("", stored));
    }

    @Test
    void pbkdf2CommitmentIsSaltedAndSelfDescribing() {
        String first = pbkdf2.commit("Tr0ub4dor&3");
        String second = pbkdf2.commit("Tr0ub4dor&3");

        assertTrue(first.startsWith("pbkdf2-sha256$100000$"));
        assertNotEquals(first, second, "Each commitment gets its own salt");
        assertTrue(pbkdf2.matches("Tr0ub4dor&3", first));
        assertTrue(pbkdf2.matches("Tr0ub4dor&3", second));
        assertFalse(pbkdf2.matches("WrongPass", first));
    }

    @Test
    void eitherStoredFormatVerifiesRegardlessOfConfiguredScheme() {
        assertTrue(pbkdf2.matches("Tr0ub4dor&3", sha256.commit("Tr0ub4dor&3")));
        assertTrue(sha256.matches("Tr0ub4dor&3", pbkdf2.commit("Tr0ub4dor&3")));
    }

    @Test
    void storedWorkFactorAboveCeilingIsRefusedWithoutDeriving() {
        String genuine = pbkdf2.commit("Tr0ub4dor&3");
        String[] parts = genuine.split("\\$");
        String inflated = parts[0] + "$" + Integer.MAX_VALUE + "$" + parts[2] + "$" + parts[3];
        String justAbove = parts[0] + "$" + (KeyDerivation.MIN_ITERATIONS * PassphraseCommitment.MAX_ITERATION_FACTOR + 1)
                + "$" + parts[2] + "$" + parts[3];

        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            assertFalse(pbkdf2.matches("Tr0ub4dor&3", inflated));
            assertFalse(sha256.matches("Tr0ub4dor&3", justAbove));
        });
    }

    @Test
    void malformedStoredValuesNeverMatch() {
        assertFalse(sha256.matches("Tr0ub4dor&3", null));
        assertFalse(sha256.matches("Tr0ub4dor&3", ""));
        assertFalse(sha256.matches("Tr0ub4dor&3", "%%% not base64 %%%"));
        assertFalse(sha256.matches("Tr0ub4dor&3", "pbkdf2-sha256$abc$AAAA$AAAA"));
        assertFalse(sha256.matches("Tr0ub4dor&3", "pbkdf2-sha256$100000$AAAA"));
        assertFalse(sha256.matches("Tr0ub4dor&3", "pbkdf2-sha256$10$AAAAAAAAAAAAAAAAAAAAAA==$AAAA"));
    }
}
