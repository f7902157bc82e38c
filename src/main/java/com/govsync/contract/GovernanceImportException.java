package com.govsync.contract;

/**
 * Root of the import failure taxonomy. The {@link #kind()} is the machine-readable
 * discriminator returned to callers in {@code error.kind}.
 */
public abstract class GovernanceImportException extends RuntimeException {

    private String payloadHash;

    protected GovernanceImportException(String message) {
        super(message);
    }

    protected GovernanceImportException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String kind();

    public String getPayloadHash() {
        return payloadHash;
    }

    /** Correlates the failure with the audit record written for the same attempt. */
    public GovernanceImportException withPayloadHash(String payloadHash) {
        if (this.payloadHash == null) {
            this.payloadHash = payloadHash;
        }
        return this;
    }
}
