package com.govsync.bus;

import com.govsync.contract.EntryType;
import com.govsync.contract.ImportValidationException;
import com.govsync.contract.StatusMapper;
import com.govsync.persistence.TransactionCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Direct edits of governance log entries. Each edit runs in its own transaction and its
 * event is published only after the commit succeeded.
 */
@Service
public class GovernanceLogService {

    private static final Logger log = LoggerFactory.getLogger(GovernanceLogService.class);

    static final String SOURCE_API = "api";

    private final GovernanceLogStore store;
    private final GovernanceLogBus bus;
    private final TransactionCoordinator transactions;
    private final Clock clock;

    public GovernanceLogService(GovernanceLogStore store,
                                GovernanceLogBus bus,
                                TransactionCoordinator transactions,
                                Clock clock) {
        this.store = store;
        this.bus = bus;
        this.transactions = transactions;
        this.clock = clock;
    }

    public GovernanceLogEntry create(GovernanceLogDraft draft) {
        GovernanceLogEntry entry = toEntry(UUID.randomUUID().toString(), draft);
        transactions.inTransaction(tx -> store.upsert(tx, entry));
        bus.publish(MutationType.CREATED, entry);
        log.info("Created governance log {} ({})", entry.id(), entry.entryType().getValue());
        return entry;
    }

    public GovernanceLogEntry update(String id, GovernanceLogDraft draft) {
        GovernanceLogEntry entry = toEntry(id, draft);
        UpsertOutcome outcome = transactions.inTransaction(tx -> {
            if (store.findById(id).isEmpty()) {
                throw new GovernanceLogNotFoundException(id);
            }
            return store.upsert(tx, entry);
        });
        if (outcome != UpsertOutcome.UNCHANGED) {
            bus.publish(MutationType.UPDATED, entry);
            log.info("Updated governance log {}", id);
        }
        return entry;
    }

    public void delete(String id) {
        GovernanceLogEntry removed = transactions.inTransaction(tx -> {
            GovernanceLogEntry existing = store.findById(id)
                .orElseThrow(() -> new GovernanceLogNotFoundException(id));
            store.delete(tx, id);
            return existing;
        });
        bus.publish(MutationType.DELETED, removed);
        log.info("Deleted governance log {}", id);
    }

    public Optional<GovernanceLogEntry> find(String id) {
        return store.findById(id);
    }

    public List<GovernanceLogEntry> list(GovernanceLogQuery query) {
        return store.query(query);
    }

    private GovernanceLogEntry toEntry(String id, GovernanceLogDraft draft) {
        if (draft == null) {
            throw new ImportValidationException("request body is required");
        }
        if (draft.summary() == null || draft.summary().isBlank()) {
            throw new ImportValidationException("summary is required and must be a non-blank string",
                "summary", draft.summary());
        }
        EntryType type = StatusMapper.entryType(draft.entryType());
        return new GovernanceLogEntry(
            id,
            type,
            draft.timestamp() != null ? draft.timestamp() : clock.instant(),
            draft.actor(),
            draft.summary(),
            GovernanceLogEntry.withOriginalEntryType(draft.details(), draft.entryType(), type),
            draft.projectId(),
            draft.phaseId(),
            draft.stepId(),
            draft.memoryAnchorId(),
            SOURCE_API
        );
    }
}
