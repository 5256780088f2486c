package com.securevault.vault;

import com.securevault.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VaultAuditTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-06-01T00:00:00Z"));
    private final VaultAudit audit = new VaultAudit(clock, Duration.ofDays(90));

    @Test
    void reportsReusedPasswordsStaleRecordsAndUnreadables() {
        DecryptedRecord github = record("1", "hunter2", Instant.parse("2026-05-01T00:00:00Z"));
        DecryptedRecord gitlab = record("2", "hunter2", Instant.parse("2026-05-20T00:00:00Z"));
        DecryptedRecord bank = record("3", "unique!", Instant.parse("2025-12-01T00:00:00Z"));
        VaultListing listing = new VaultListing(List.of(github, gitlab, bank), 4,
                List.of(new SkippedRecord("4", SkippedRecord.Reason.INTEGRITY)));

        VaultAudit.Report report = audit.audit(listing);

        assertEquals(List.of(List.of(github, gitlab)), report.duplicateGroups());
        assertEquals(List.of(bank), report.staleRecords());
        assertEquals(1, report.unreadable());
        assertFalse(report.isClean());
    }

    @Test
    void emptyVaultIsClean() {
        assertTrue(audit.audit(VaultListing.empty()).isClean());
    }

    private static DecryptedRecord record(String id, String password, Instant lastModified) {
        return new DecryptedRecord(id, id + ".com", "user", password, null, "other", null,
                lastModified, lastModified);
    }
}
