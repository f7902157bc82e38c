package com.govsync.audit;

import java.util.List;

/**
 * Append-only trail of import attempts. Records are never rewritten.
 */
public interface ImportAuditLog {

    /** @return the record as stored, with its chain hashes */
    ImportRecord append(ImportRecord record);

    /** Newest first, at most {@code n} records (further capped by configuration). */
    List<ImportRecord> recent(int n);

    ChainVerification verifyChain();
}
