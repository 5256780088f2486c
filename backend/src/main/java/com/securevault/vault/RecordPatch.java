package com.securevault.vault;

/**
 * Partial update of a record.
 *
 * <p>{@code website}, {@code username}, {@code password} and {@code category}
 * are kept when null or empty. {@code url} and {@code notes} are kept only when
 * null; an empty string clears them.
 */
public record RecordPatch(
        String website,
        String username,
        String password,
        String url,
        String category,
        String notes
) {

    public static RecordPatch empty() {
        return new RecordPatch(null, null, null, null, null, null);
    }

    public RecordPatch withWebsite(String value) {
        return new RecordPatch(value, username, password, url, category, notes);
    }

    public RecordPatch withUsername(String value) {
        return new RecordPatch(website, value, password, url, category, notes);
    }

    public RecordPatch withPassword(String value) {
        return new RecordPatch(website, username, value, url, category, notes);
    }

    public RecordPatch withUrl(String value) {
        return new RecordPatch(website, username, password, value, category, notes);
    }

    public RecordPatch withCategory(String value) {
        return new RecordPatch(website, username, password, url, value, notes);
    }

    public RecordPatch withNotes(String value) {
        return new RecordPatch(website, username, password, url, category, value);
    }

    boolean changesPassword() {
        return password != null && !password.isEmpty();
    }
}
