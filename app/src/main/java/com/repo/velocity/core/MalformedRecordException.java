package com.repo.velocity.core;

/**
 * Raised when a harvested record is missing a required field or carries an
 * impossible value (negative line counts, merge before creation, ...).
 * Callers at the ingestion boundary skip the record and keep going.
 */
public class MalformedRecordException extends IllegalArgumentException {

    private final String recordId;

    public MalformedRecordException(String recordId, String message) {
        super(message);
        this.recordId = recordId;
    }

    /**
     * Identifier of the offending record, or "?" when it had none.
     */
    public String getRecordId() {
        return recordId;
    }

    static String idOrUnknown(String id) {
        return id == null || id.isBlank() ? "?" : id;
    }

    static void requireText(String id, String value, String field) {
        if (value == null || value.isBlank()) {
            throw new MalformedRecordException(idOrUnknown(id), "missing " + field);
        }
    }

    static void requirePresent(String id, Object value, String field) {
        if (value == null) {
            throw new MalformedRecordException(idOrUnknown(id), "missing " + field);
        }
    }

    static void requireNonNegative(String id, int value, String field) {
        if (value < 0) {
            throw new MalformedRecordException(idOrUnknown(id), field + " must be >= 0 but was " + value);
        }
    }
}
