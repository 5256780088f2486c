package com.securevault.vault;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hygiene report over a decrypted listing: passwords reused across records and
 * records not touched for longer than {@code staleAfter}.
 */
public class VaultAudit {

    private final Clock clock;
    private final Duration staleAfter;

    public VaultAudit(Clock clock, Duration staleAfter) {
        this.clock = clock;
        this.staleAfter = staleAfter;
    }

    public Report audit(VaultListing listing) {
        Map<String, List<DecryptedRecord>> byPassword = new LinkedHashMap<>();
        for (DecryptedRecord record : listing.records()) {
            byPassword.computeIfAbsent(record.password(), p -> new ArrayList<>()).add(record);
        }
        List<List<DecryptedRecord>> duplicates = byPassword.values().stream()
                .filter(group -> group.size() > 1)
                .map(List::copyOf)
                .toList();

        Instant threshold = clock.instant().minus(staleAfter);
        List<DecryptedRecord> stale = listing.records().stream()
                .filter(record -> record.lastModified().isBefore(threshold))
                .toList();

        return new Report(duplicates, stale, listing.skipped().size());
    }

    /**
     * @param duplicateGroups records sharing one password, groups of two or more
     * @param staleRecords    records last modified before the staleness threshold
     * @param unreadable      records the listing could not decrypt
     */
    public record Report(
            List<List<DecryptedRecord>> duplicateGroups,
            List<DecryptedRecord> staleRecords,
            int unreadable
    ) {

        public boolean isClean() {
            return duplicateGroups.isEmpty() && staleRecords.isEmpty() && unreadable == 0;
        }
    }
}
