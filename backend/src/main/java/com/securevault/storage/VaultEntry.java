package com.securevault.storage;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

import java.nio.ByteBuffer;
import java.time.Instant;

/**
 * One row of the vault key-value table. The value is opaque to Cassandra: it
 * is either the passphrase commitment or the JSON record collection, which
 * itself only holds ciphertext for secrets.
 */
@Table("vault_entries")
public class VaultEntry {

    @PrimaryKey("entry_key")
    private String key;

    @Column("entry_value")
    private ByteBuffer value;

    @Column("updated_at")
    private Instant updatedAt;

    public VaultEntry() {}

    public VaultEntry(String key, byte[] value, Instant updatedAt) {
        this.key = key;
        this.value = value == null ? null : ByteBuffer.wrap(value.clone());
        this.updatedAt = updatedAt;
    }

    public byte[] valueBytes() {
        if (value == null) {
            return new byte[0];
        }
        ByteBuffer view = value.duplicate();
        byte[] bytes = new byte[view.remaining()];
        view.get(bytes);
        return bytes;
    }

    // Getters & Setters
    public String getKey() { return key; }
    public void setKey(String key) { this.key = key; }
    public ByteBuffer getValue() { return value; }
    public void setValue(ByteBuffer value) { this.value = value; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
