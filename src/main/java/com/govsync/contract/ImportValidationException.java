package com.govsync.contract;

/**
 * Structural problem with an inbound bundle. Raised before any transaction is opened.
 */
public class ImportValidationException extends GovernanceImportException {

    private final String field;
    private final String value;

    public ImportValidationException(String message) {
        this(message, null, null);
    }

    public ImportValidationException(String message, String field, String value) {
        super(message);
        this.field = field;
        this.value = value;
    }

    @Override
    public String kind() {
        return "validation";
    }

    public String getField() {
        return field;
    }

    public String getValue() {
        return value;
    }
}
