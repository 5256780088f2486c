package com.securevault.vault;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.securevault.crypto.RecordCodec;
import com.securevault.error.VaultFormatException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * JSON form of the encrypted record collection, shared by storage and export:
 * <pre>
 * [ { "id", "website", "username", "encryptedPassword", "url"?, "category",
 *     "notes"?, "createdAt", "lastModified" }, ... ]
 * </pre>
 * Timestamps are ISO-8601 instants.
 */
public class RecordCollectionCodec {

    private final JsonMapper mapper;
    private final RecordCodec blobCodec;

    public RecordCollectionCodec(RecordCodec blobCodec) {
        this.blobCodec = blobCodec;
        this.mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .build();
    }

    public byte[] write(List<VaultRecord> records) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(records);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise record collection", e);
        }
    }

    /**
     * Reads the persisted collection. Only the structure is checked here; a
     * record whose blob is damaged, missing or not text still loads and is
     * dealt with when it is decrypted.
     */
    public List<VaultRecord> read(byte[] json) {
        return parse(json, false);
    }

    /**
     * Reads an import snapshot. On top of the structure, every
     * {@code encryptedPassword} must decode as a blob and ids must be unique.
     * Nothing is decrypted.
     */
    public List<VaultRecord> readSnapshot(String json) {
        if (json == null) {
            throw new VaultFormatException("Import snapshot is empty");
        }
        return parse(json.getBytes(StandardCharsets.UTF_8), true);
    }

    private List<VaultRecord> parse(byte[] json, boolean strict) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (IOException e) {
            throw new VaultFormatException("Invalid data format: not JSON", e);
        }
        if (root == null || !root.isArray()) {
            throw new VaultFormatException("Invalid data format: expected an array of records");
        }

        List<VaultRecord> records = new ArrayList<>(root.size());
        Set<String> ids = new HashSet<>();
        int index = 0;
        for (JsonNode node : root) {
            VaultRecord record = toRecord(node, index, strict);
            if (strict) {
                blobCodec.decode(record.encryptedPassword());
                if (!ids.add(record.id())) {
                    throw new VaultFormatException("Duplicate record id at index " + index);
                }
            }
            records.add(record);
            index++;
        }
        return records;
    }

    private static VaultRecord toRecord(JsonNode node, int index, boolean strict) {
        if (!node.isObject()) {
            throw new VaultFormatException("Record " + index + " is not an object");
        }
        String id = requiredText(node, "id", index);
        if (id.isBlank()) {
            throw new VaultFormatException("Record " + index + " has a blank id");
        }
        return new VaultRecord(
                id,
                requiredText(node, "website", index),
                requiredText(node, "username", index),
                strict ? requiredText(node, "encryptedPassword", index) : blobText(node),
                optionalText(node, "url", index),
                requiredText(node, "category", index),
                optionalText(node, "notes", index),
                instant(node, "createdAt", index),
                instant(node, "lastModified", index));
    }

    private static String requiredText(JsonNode node, String field, int index) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new VaultFormatException("Record " + index + " is missing text field '" + field + "'");
        }
        return value.textValue();
    }

    /**
     * A damaged blob field reads as null; that record alone is then skipped as
     * unreadable when the collection is decrypted.
     */
    private static String blobText(JsonNode node) {
        JsonNode value = node.get("encryptedPassword");
        return value != null && value.isTextual() ? value.textValue() : null;
    }

    private static String optionalText(JsonNode node, String field, int index) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new VaultFormatException("Record " + index + " field '" + field + "' must be text");
        }
        return value.textValue();
    }

    private static Instant instant(JsonNode node, String field, int index) {
        String text = requiredText(node, field, index);
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new VaultFormatException("Record " + index + " field '" + field + "' is not an ISO-8601 instant", e);
        }
    }
}
