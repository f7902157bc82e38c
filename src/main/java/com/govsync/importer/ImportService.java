package com.govsync.importer;

import com.fasterxml.jackson.databind.JsonNode;
import com.govsync.audit.AuditLogException;
import com.govsync.audit.ImportAuditLog;
import com.govsync.audit.ImportRecord;
import com.govsync.audit.ImportStatus;
import com.govsync.bus.GovernanceLogBus;
import com.govsync.contract.BundleValidator;
import com.govsync.contract.GovernanceImportException;
import com.govsync.contract.GovernanceLogBatch;
import com.govsync.contract.ImportValidationException;
import com.govsync.contract.MemoryAnchorBatch;
import com.govsync.contract.PayloadFingerprinter;
import com.govsync.contract.PhaseBatch;
import com.govsync.contract.ProjectBundle;
import com.govsync.contract.StepBatch;
import com.govsync.persistence.ImportTransaction;
import com.govsync.persistence.PersistenceException;
import com.govsync.persistence.TransactionCoordinator;
import com.govsync.trigger.AutomationTriggerEvaluator;
import com.govsync.trigger.ImportSnapshot;
import com.govsync.trigger.TriggerOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Import pipeline: fingerprint, in-flight guard, validation, one transaction for all
 * writes, publication of committed governance-log changes, automation triggers and
 * exactly one audit record per attempt.
 */
@Service
public class ImportService {

    private static final Logger log = LoggerFactory.getLogger(ImportService.class);

    static final String MDC_FINGERPRINT = "fingerprint";
    static final String MDC_IMPORT_KIND = "importKind";

    private final BundleValidator validator;
    private final PayloadFingerprinter fingerprinter;
    private final InFlightImports inFlight;
    private final TransactionCoordinator transactions;
    private final EntityImporter importer;
    private final GovernanceLogBus bus;
    private final AutomationTriggerEvaluator triggers;
    private final ImportAuditLog auditLog;
    private final Clock clock;

    public ImportService(BundleValidator validator,
                         PayloadFingerprinter fingerprinter,
                         InFlightImports inFlight,
                         TransactionCoordinator transactions,
                         EntityImporter importer,
                         GovernanceLogBus bus,
                         AutomationTriggerEvaluator triggers,
                         ImportAuditLog auditLog,
                         Clock clock) {
        this.validator = validator;
        this.fingerprinter = fingerprinter;
        this.inFlight = inFlight;
        this.transactions = transactions;
        this.importer = importer;
        this.bus = bus;
        this.triggers = triggers;
        this.auditLog = auditLog;
        this.clock = clock;
    }

    public ImportResult importProject(JsonNode payload) {
        return run(ImportKind.PROJECT, payload, validator::validateProjectBundle,
            new ImportWork<ProjectBundle>() {
                @Override
                public String projectId(ProjectBundle bundle) {
                    return bundle.project().projectId();
                }

                @Override
                public String submittedBy(ProjectBundle bundle) {
                    return bundle.submittedBy();
                }

                @Override
                public void write(ImportContext ctx, ProjectBundle bundle) {
                    importer.importProject(ctx.tx(), bundle, ctx.ledger());
                }
            });
    }

    public ImportResult importMemoryAnchors(JsonNode payload) {
        return run(ImportKind.MEMORY_ANCHORS, payload, validator::validateMemoryAnchorBatch,
            new ImportWork<MemoryAnchorBatch>() {
                @Override
                public String projectId(MemoryAnchorBatch batch) {
                    return null;
                }

                @Override
                public String submittedBy(MemoryAnchorBatch batch) {
                    return batch.submittedBy();
                }

                @Override
                public void write(ImportContext ctx, MemoryAnchorBatch batch) {
                    importer.importAnchors(ctx.tx(), batch.memoryAnchors(), ctx.ledger());
                }
            });
    }

    public ImportResult importPhases(JsonNode payload) {
        return run(ImportKind.PHASES, payload, validator::validatePhaseBatch,
            new ImportWork<PhaseBatch>() {
                @Override
                public String projectId(PhaseBatch batch) {
                    return batch.projectId();
                }

                @Override
                public String submittedBy(PhaseBatch batch) {
                    return batch.submittedBy();
                }

                @Override
                public void write(ImportContext ctx, PhaseBatch batch) {
                    importer.importPhases(ctx.tx(), batch, ctx.ledger());
                }
            });
    }

    public ImportResult importSteps(JsonNode payload) {
        return run(ImportKind.STEPS, payload, validator::validateStepBatch,
            new ImportWork<StepBatch>() {
                @Override
                public String projectId(StepBatch batch) {
                    return batch.projectId();
                }

                @Override
                public String submittedBy(StepBatch batch) {
                    return batch.submittedBy();
                }

                @Override
                public void write(ImportContext ctx, StepBatch batch) {
                    importer.importSteps(ctx.tx(), batch, ctx.ledger());
                }
            });
    }

    public ImportResult importGovernanceLogs(JsonNode payload) {
        return run(ImportKind.GOVERNANCE_LOGS, payload, validator::validateGovernanceLogBatch,
            new ImportWork<GovernanceLogBatch>() {
                @Override
                public String projectId(GovernanceLogBatch batch) {
                    return batch.projectId();
                }

                @Override
                public String submittedBy(GovernanceLogBatch batch) {
                    return batch.submittedBy();
                }

                @Override
                public void write(ImportContext ctx, GovernanceLogBatch batch) {
                    importer.importGovernanceLogs(ctx.tx(), batch, ctx.ledger());
                }
            });
    }

    private <T> ImportResult run(ImportKind kind, JsonNode payload, Function<JsonNode, T> validate,
                                 ImportWork<T> work) {
        String fingerprint = fingerprinter.fingerprint(payload);
        try (MDC.MDCCloseable ignoredFingerprint = MDC.putCloseable(MDC_FINGERPRINT, fingerprint);
             MDC.MDCCloseable ignoredKind = MDC.putCloseable(MDC_IMPORT_KIND, kind.operation())) {
            if (!inFlight.tryAcquire(fingerprint)) {
                DuplicateImportException duplicate = new DuplicateImportException(fingerprint);
                log.warn("Rejected {}: identical payload already in flight", kind.operation());
                auditFailure(kind, fingerprint, submittedByHint(payload), duplicate);
                throw duplicate;
            }
            try {
                return runAcquired(kind, payload, fingerprint, validate, work);
            } finally {
                inFlight.release(fingerprint);
            }
        }
    }

    private <T> ImportResult runAcquired(ImportKind kind, JsonNode payload, String fingerprint,
                                         Function<JsonNode, T> validate, ImportWork<T> work) {
        T validated;
        try {
            validated = validate.apply(payload);
        } catch (ImportValidationException ex) {
            log.warn("Rejected {}: {}", kind.operation(), ex.getMessage());
            auditFailure(kind, fingerprint, submittedByHint(payload), ex);
            throw ex;
        } catch (IllegalArgumentException ex) {
            ImportValidationException wrapped = new ImportValidationException(ex.getMessage());
            auditFailure(kind, fingerprint, submittedByHint(payload), wrapped);
            throw wrapped;
        }

        String projectId = work.projectId(validated);
        String submittedBy = work.submittedBy(validated);
        log.info("Accepted {} for project {}", kind.operation(), projectId);

        ImportLedger ledger = new ImportLedger();
        ImportSnapshot snapshot;
        try {
            snapshot = transactions.inTransaction(tx -> {
                work.write(new ImportContext(tx, ledger), validated);
                return kind.triggersAutomation() ? importer.snapshot(tx, projectId, ledger) : null;
            });
        } catch (GovernanceImportException ex) {
            log.warn("{} rolled back: {}", kind.operation(), ex.getMessage());
            auditFailure(kind, fingerprint, submittedBy, ex);
            throw ex;
        } catch (RuntimeException ex) {
            log.error("{} rolled back on unexpected failure", kind.operation(), ex);
            PersistenceException wrapped = new PersistenceException("import failed: " + ex.getMessage(), ex);
            auditFailure(kind, fingerprint, submittedBy, wrapped);
            throw wrapped;
        }
        log.info("Committed {} for project {}: {}", kind.operation(), projectId, ledger.counts());

        ledger.mutations().forEach(mutation -> bus.publish(mutation.type(), mutation.entry()));

        List<TriggerOutcome> outcomes = snapshot != null ? evaluateTriggers(snapshot, fingerprint) : List.of();
        boolean partial = outcomes.stream().anyMatch(TriggerOutcome::failed);

        Instant now = clock.instant();
        ImportResult result = kind == ImportKind.MEMORY_ANCHORS
            ? ImportResult.anchors(ledger.anchorIds(), ledger.linkedSteps(), fingerprint, now)
            : ImportResult.hierarchy(projectId, ledger.counts(), outcomes, fingerprint, now);

        Map<String, Object> details = new LinkedHashMap<>();
        if (projectId != null) {
            details.put("projectId", projectId);
        }
        details.put("recordsImported", ledger.counts());
        if (!outcomes.isEmpty()) {
            details.put("agentTriggers", outcomes);
        }
        if (!ledger.anchorIds().isEmpty()) {
            details.put("anchorIds", ledger.anchorIds());
        }
        int recordCount = kind == ImportKind.MEMORY_ANCHORS
            ? ledger.anchorIds().size()
            : ledger.counts().total();
        ImportStatus status = partial ? ImportStatus.PARTIAL : ImportStatus.SUCCESS;
        boolean audited = audit(ImportRecord.of(fingerprint, now, kind.operation(), recordCount, status,
            details, partial ? "one or more automation triggers failed" : null, submittedBy));
        return audited ? result : result.withAuditMissing();
    }

    // the data is committed; an automation failure only degrades the outcome to partial
    private List<TriggerOutcome> evaluateTriggers(ImportSnapshot snapshot, String fingerprint) {
        try {
            return triggers.evaluate(snapshot, fingerprint);
        } catch (RuntimeException ex) {
            log.error("Automation evaluation failed for project {}", snapshot.projectId(), ex);
            return triggers.agents().stream()
                .map(agent -> TriggerOutcome.failed(agent, null, String.valueOf(ex.getMessage())))
                .toList();
        }
    }

    private void auditFailure(ImportKind kind, String fingerprint, String submittedBy,
                              GovernanceImportException ex) {
        ex.withPayloadHash(fingerprint);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("kind", ex.kind());
        if (ex instanceof ImportValidationException validation && validation.getField() != null) {
            details.put("field", validation.getField());
        } else if (ex instanceof PreconditionViolationException precondition && precondition.getField() != null) {
            details.put("field", precondition.getField());
        }
        audit(ImportRecord.of(fingerprint, clock.instant(), kind.operation(), 0, ImportStatus.ERROR,
            details, ex.getMessage(), submittedBy));
    }

    // the import outcome stands even when its audit record cannot be written
    private boolean audit(ImportRecord record) {
        try {
            auditLog.append(record);
            return true;
        } catch (AuditLogException ex) {
            log.error("Failed to write audit record for {} ({})", record.operation(), record.status().getValue(), ex);
            return false;
        }
    }

    private static String submittedByHint(JsonNode payload) {
        if (payload == null) {
            return null;
        }
        for (String path : List.of("/meta/submittedBy", "/oAppMeta/submittedBy", "/submittedBy")) {
            JsonNode node = payload.at(path);
            if (node.isTextual()) {
                return node.asText();
            }
        }
        return null;
    }

    private interface ImportWork<T> {

        String projectId(T validated);

        String submittedBy(T validated);

        void write(ImportContext ctx, T validated);
    }

    private record ImportContext(ImportTransaction tx, ImportLedger ledger) {
    }
}
