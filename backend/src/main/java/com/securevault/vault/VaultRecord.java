package com.securevault.vault;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * A record as it is persisted: plaintext metadata plus the password sealed in
 * {@code encryptedPassword}. The plaintext password is never part of this type.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VaultRecord(
        String id,
        String website,
        String username,
        String encryptedPassword,   // base64(salt || iv || ciphertext+tag)
        String url,                 // optional
        String category,
        String notes,               // optional
        Instant createdAt,
        Instant lastModified
) {

    DecryptedRecord withPassword(String password) {
        return new DecryptedRecord(id, website, username, password, url, category, notes, createdAt, lastModified);
    }
}
