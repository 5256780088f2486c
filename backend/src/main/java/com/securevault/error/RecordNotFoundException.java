package com.securevault.error;

public class RecordNotFoundException extends VaultException {

    private final String recordId;

    public RecordNotFoundException(String recordId) {
        super("Password entry not found: " + recordId);
        this.recordId = recordId;
    }

    public String getRecordId() {
        return recordId;
    }
}
