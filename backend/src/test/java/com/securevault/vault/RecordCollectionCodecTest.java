package com.securevault.vault;

import com.securevault.crypto.RecordCodec;
import com.securevault.error.VaultFormatException;
import com.securevault.support.VaultFixtures;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecordCollectionCodecTest {

    private final RecordCollectionCodec codec = new RecordCollectionCodec(new RecordCodec());

    private static final Instant CREATED = Instant.parse("2026-01-15T08:30:00Z");

    @Test
    void writesIsoTimestampsAndOmitsAbsentOptionals() {
        VaultRecord record = new VaultRecord("id-1", "github.com", "alice", "AAAA",
                null, "work", null, CREATED, CREATED);

        String json = new String(codec.write(List.of(record)), StandardCharsets.UTF_8);

        assertTrue(json.contains("\"createdAt\" : \"2026-01-15T08:30:00Z\""), json);
        assertFalse(json.contains("\"url\""));
        assertFalse(json.contains("\"notes\""));
        assertEquals(List.of(record), codec.read(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void readKeepsRecordsWithDamagedBlobs() {
        String json = """
                [{"id":"1","website":"a.com","username":"","encryptedPassword":"AAAA",
                  "category":"other","createdAt":"2026-01-01T00:00:00Z","lastModified":"2026-01-01T00:00:00Z"}]
                """;

        List<VaultRecord> records = codec.read(json.getBytes(StandardCharsets.UTF_8));

        assertEquals(1, records.size());
        assertEquals("AAAA", records.get(0).encryptedPassword());
    }

    @Test
    void readLetsDamagedBlobFieldThroughButSnapshotRefusesIt() {
        String json = """
                [{"id":"1","website":"a.com","username":"u","encryptedPassword":null,
                  "category":"other","createdAt":"2026-01-01T00:00:00Z","lastModified":"2026-01-01T00:00:00Z"},
                 {"id":"2","website":"b.com","username":"u",
                  "category":"other","createdAt":"2026-01-01T00:00:00Z","lastModified":"2026-01-01T00:00:00Z"}]
                """;

        List<VaultRecord> records = codec.read(json.getBytes(StandardCharsets.UTF_8));

        assertEquals(2, records.size());
        assertNull(records.get(0).encryptedPassword());
        assertNull(records.get(1).encryptedPassword());
        assertThrows(VaultFormatException.class, () -> codec.readSnapshot(json));
    }

    @Test
    void snapshotRejectsUndecodableBlob() {
        String json = """
                [{"id":"1","website":"a.com","username":"u","encryptedPassword":"AAAA",
                  "category":"other","createdAt":"2026-01-01T00:00:00Z","lastModified":"2026-01-01T00:00:00Z"}]
                """;

        assertThrows(VaultFormatException.class, () -> codec.readSnapshot(json));
    }

    @Test
    void snapshotRejectsDuplicateIds() {
        String blob = VaultFixtures.sealer().seal("pw", "Tr0ub4dor&3");
        String entry = """
                {"id":"same","website":"a.com","username":"u","encryptedPassword":"%s",
                 "category":"other","createdAt":"2026-01-01T00:00:00Z","lastModified":"2026-01-01T00:00:00Z"}
                """.formatted(blob);

        assertEquals(1, codec.readSnapshot("[" + entry + "]").size());
        assertThrows(VaultFormatException.class, () -> codec.readSnapshot("[" + entry + "," + entry + "]"));
    }

    @Test
    void rejectsStructurallyInvalidInput() {
        assertThrows(VaultFormatException.class, () -> codec.readSnapshot(null));
        assertThrows(VaultFormatException.class, () -> codec.readSnapshot("not json"));
        assertThrows(VaultFormatException.class, () -> codec.readSnapshot("{}"));
        assertThrows(VaultFormatException.class, () -> codec.readSnapshot("[42]"));
        assertThrows(VaultFormatException.class, () -> codec.readSnapshot("""
                [{"id":"1","website":"a.com","username":"u","encryptedPassword":"AAAA",
                  "category":"other","createdAt":"yesterday","lastModified":"2026-01-01T00:00:00Z"}]
                """));
        assertThrows(VaultFormatException.class, () -> codec.readSnapshot("""
                [{"id":"1","website":"a.com","encryptedPassword":"AAAA",
                  "category":"other","createdAt":"2026-01-01T00:00:00Z","lastModified":"2026-01-01T00:00:00Z"}]
                """));
    }

    @Test
    void emptyArrayIsAnEmptyCollection() {
        assertEquals(List.of(), codec.readSnapshot("[]"));
    }
}
