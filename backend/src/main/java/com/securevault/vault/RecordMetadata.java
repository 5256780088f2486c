package com.securevault.vault;

/**
 * The plaintext fields supplied when a record is added. The secret itself is
 * passed separately so it never sits in a metadata object.
 */
public record RecordMetadata(
        String website,
        String username,
        String url,
        String category,
        String notes
) {

    public static final String DEFAULT_CATEGORY = "other";

    public RecordMetadata {
        if (website == null || website.isBlank()) {
            throw new IllegalArgumentException("website is required");
        }
        if (username == null) {
            throw new IllegalArgumentException("username is required");
        }
        if (category == null || category.isBlank()) {
            category = DEFAULT_CATEGORY;
        }
    }

    public static RecordMetadata of(String website, String username) {
        return new RecordMetadata(website, username, null, null, null);
    }
}
