package com.govsync.persistence;

import com.govsync.contract.GovernanceImportException;

/**
 * Storage failure. The surrounding transaction is rolled back before this reaches a caller.
 */
public class PersistenceException extends GovernanceImportException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    public PersistenceException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "persistence";
    }
}
