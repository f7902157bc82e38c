package com.govsync.importer;

import com.govsync.contract.GovernanceImportException;

/** An identical payload is already being imported. */
public class DuplicateImportException extends GovernanceImportException {

    public DuplicateImportException(String fingerprint) {
        super("an identical import is already in progress (" + fingerprint + ")");
        withPayloadHash(fingerprint);
    }

    @Override
    public String kind() {
        return "duplicate";
    }
}
