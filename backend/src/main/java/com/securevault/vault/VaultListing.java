package com.securevault.vault;

import java.util.List;

/**
 * Result of a bulk decryption. Records that could not be opened are dropped
 * from {@link #records()} but always accounted for in {@link #skipped()}, so
 * {@code records().size() + skipped().size() == storedCount()}.
 */
public record VaultListing(
        List<DecryptedRecord> records,
        int storedCount,
        List<SkippedRecord> skipped
) {

    public VaultListing {
        records = List.copyOf(records);
        skipped = List.copyOf(skipped);
    }

    public static VaultListing empty() {
        return new VaultListing(List.of(), 0, List.of());
    }

    public boolean isComplete() {
        return skipped.isEmpty();
    }

    public int missingCount() {
        return storedCount - records.size();
    }
}
