package com.govsync.bus;

import com.govsync.persistence.ImportTransaction;

import java.util.List;
import java.util.Optional;

public interface GovernanceLogStore {

    /**
     * Inserts the entry, or replaces the stored entry with the same id. A content-identical
     * entry is left untouched and reported as {@link UpsertOutcome#UNCHANGED}.
     */
    UpsertOutcome upsert(ImportTransaction tx, GovernanceLogEntry entry);

    boolean delete(ImportTransaction tx, String id);

    Optional<GovernanceLogEntry> findById(String id);

    /** Newest first. */
    List<GovernanceLogEntry> query(GovernanceLogQuery query);
}
