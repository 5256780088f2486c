package com.securevault.vault;

import java.time.Instant;

/**
 * In-memory view of a record with its password opened. Never persisted.
 */
public record DecryptedRecord(
        String id,
        String website,
        String username,
        String password,
        String url,
        String category,
        String notes,
        Instant createdAt,
        Instant lastModified
) {

    @Override
    public String toString() {
        return "DecryptedRecord[id=" + id + ", website=" + website + ", username=" + username
                + ", password=****, category=" + category + ", lastModified=" + lastModified + "]";
    }
}
