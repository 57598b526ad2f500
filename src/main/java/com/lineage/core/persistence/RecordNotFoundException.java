package com.lineage.core.persistence;

/**
 * Thrown by writes that require an existing record which is absent.
 */
public class RecordNotFoundException extends StorageException {

    private final String recordId;

    public RecordNotFoundException(String kind, String recordId) {
        super(kind + " not found: " + recordId);
        this.recordId = recordId;
    }

    public String getRecordId() {
        return recordId;
    }
}
