package com.govsync.importer;

import com.govsync.contract.GovernanceImportException;

/**
 * The import is well-formed but conflicts with stored state, such as an anchor linked to a
 * step that is not completed with QA passed. Raised inside the transaction, which is rolled back.
 */
public class PreconditionViolationException extends GovernanceImportException {

    private final String field;
    private final String value;

    public PreconditionViolationException(String message, String field, String value) {
        super(message);
        this.field = field;
        this.value = value;
    }

    @Override
    public String kind() {
        return "precondition";
    }

    public String getField() {
        return field;
    }

    public String getValue() {
        return value;
    }
}
