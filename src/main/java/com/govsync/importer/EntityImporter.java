package com.govsync.importer;

import com.govsync.bus.GovernanceLogEntry;
import com.govsync.bus.GovernanceLogStore;
import com.govsync.bus.UpsertOutcome;
import com.govsync.config.GovSyncProperties;
import com.govsync.contract.EntryType;
import com.govsync.contract.GovernanceLogBatch;
import com.govsync.contract.GovernanceLogData;
import com.govsync.contract.MemoryAnchorData;
import com.govsync.contract.PhaseBatch;
import com.govsync.contract.PhaseData;
import com.govsync.contract.ProjectBundle;
import com.govsync.contract.ProjectData;
import com.govsync.contract.StatusMapper;
import com.govsync.contract.StepBatch;
import com.govsync.contract.StepData;
import com.govsync.contract.StepStatus;
import com.govsync.persistence.GovernanceRepository;
import com.govsync.persistence.GovernanceRepository.AnchorRow;
import com.govsync.persistence.GovernanceRepository.PhaseRow;
import com.govsync.persistence.GovernanceRepository.ProjectRow;
import com.govsync.persistence.GovernanceRepository.StepRow;
import com.govsync.persistence.GovernanceRepository.StepState;
import com.govsync.persistence.ImportTransaction;
import com.govsync.trigger.ImportSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Writes validated imports into the open transaction, top-down: project, phases, steps,
 * governance entries, then memory anchors. Every method records what it wrote in the
 * {@link ImportLedger}; nothing here commits, rolls back or publishes.
 */
@Component
public class EntityImporter {

    private static final Logger log = LoggerFactory.getLogger(EntityImporter.class);

    static final String SOURCE_IMPORT = "import";

    private final GovernanceRepository repository;
    private final GovernanceLogStore logStore;
    private final DebugStepSynthesizer debugSteps;
    private final GovSyncProperties properties;
    private final Clock clock;

    public EntityImporter(GovernanceRepository repository,
                          GovernanceLogStore logStore,
                          DebugStepSynthesizer debugSteps,
                          GovSyncProperties properties,
                          Clock clock) {
        this.repository = repository;
        this.logStore = logStore;
        this.debugSteps = debugSteps;
        this.properties = properties;
        this.clock = clock;
    }

    void importProject(ImportTransaction tx, ProjectBundle bundle, ImportLedger ledger) {
        ProjectData project = bundle.project();
        String submittedBy = bundle.submittedBy();
        Instant submittedAt = bundle.meta() != null ? bundle.meta().submissionTimestamp() : null;

        List<PhaseData> phases = new ArrayList<>(project.phases());
        if (properties.getImport().isDebugStepEnabled()) {
            Instant at = submittedAt != null ? submittedAt : clock.instant();
            Optional<StepData> debugStep = debugSteps.synthesize(project.projectId(), phases, at);
            if (debugStep.isPresent()) {
                phases.set(0, phases.get(0).withStepAppended(debugStep.get()));
                log.info("Added debug step {} to phase {}", debugStep.get().stepId(), phases.get(0).phaseId());
            }
        }

        repository.upsertProject(tx, new ProjectRow(
            project.projectId(),
            project.name(),
            project.description(),
            project.programType(),
            StatusMapper.workStatus(project.status()),
            completionPercentage(phases),
            project.metadata(),
            project.createdAt(),
            project.lastUpdated() != null ? project.lastUpdated() : submittedAt,
            submittedBy
        ));

        for (PhaseData phase : phases) {
            writePhase(tx, project.projectId(), phase, submittedBy, ledger);
        }

        if (!bundle.memoryAnchors().isEmpty()) {
            importAnchors(tx, bundle.memoryAnchors(), ledger);
        }
    }

    void importPhases(ImportTransaction tx, PhaseBatch batch, ImportLedger ledger) {
        if (!repository.projectExists(tx, batch.projectId())) {
            throw new PreconditionViolationException("project " + batch.projectId() + " does not exist",
                "projectId", batch.projectId());
        }
        for (PhaseData phase : batch.phases()) {
            writePhase(tx, batch.projectId(), phase, batch.submittedBy(), ledger);
        }
    }

    void importSteps(ImportTransaction tx, StepBatch batch, ImportLedger ledger) {
        if (!repository.phaseExists(tx, batch.projectId(), batch.phaseId())) {
            throw new PreconditionViolationException(
                "phase " + batch.phaseId() + " does not exist in project " + batch.projectId(),
                "phaseId", batch.phaseId());
        }
        for (StepData step : batch.phaseSteps()) {
            writeStep(tx, batch.projectId(), batch.phaseId(), step, batch.submittedBy(), ledger);
        }
    }

    void importGovernanceLogs(ImportTransaction tx, GovernanceLogBatch batch, ImportLedger ledger) {
        StepState step = repository.findStep(tx, batch.phaseStepId())
            .filter(state -> state.projectId().equals(batch.projectId()))
            .orElseThrow(() -> new PreconditionViolationException(
                "step " + batch.phaseStepId() + " does not exist in project " + batch.projectId(),
                "phaseStepId", batch.phaseStepId()));
        for (GovernanceLogData entry : batch.governanceLogs()) {
            writeGovernanceLog(tx, batch.projectId(), step.phaseId(), step.stepId(), entry,
                batch.submittedBy(), ledger);
        }
    }

    /**
     * Checks every anchor's linked step before writing the first anchor, so a single
     * violation leaves no anchor rows behind.
     */
    void importAnchors(ImportTransaction tx, List<MemoryAnchorData> anchors, ImportLedger ledger) {
        for (int i = 0; i < anchors.size(); i++) {
            MemoryAnchorData anchor = anchors.get(i);
            String field = "memoryAnchors[" + i + "].linkedPhaseStepId";
            StepState step = repository.findStep(tx, anchor.linkedPhaseStepId())
                .orElseThrow(() -> new PreconditionViolationException(
                    "linked step " + anchor.linkedPhaseStepId() + " of anchor " + anchor.anchorId()
                        + " does not exist", field, anchor.linkedPhaseStepId()));
            if (!step.isCompletedWithQaPassed()) {
                throw new PreconditionViolationException(
                    "anchor " + anchor.anchorId() + " requires step " + step.stepId()
                        + " to be completed with QA passed (status=" + step.status().getValue()
                        + ", qa=" + step.qaStatus().getValue() + ")",
                    field, anchor.linkedPhaseStepId());
            }
        }
        for (MemoryAnchorData anchor : anchors) {
            repository.upsertAnchor(tx, new AnchorRow(
                anchor.anchorId(),
                anchor.linkedPhaseStepId(),
                anchor.status(),
                anchor.anchorType(),
                anchor.content(),
                anchor.tags(),
                anchor.createdAt()
            ));
            ledger.anchorWritten(anchor.anchorId(), anchor.linkedPhaseStepId());
        }
    }

    /**
     * Reads back the steps this import touched, on the transaction's own connection, and
     * pairs them with the governance entries it wrote.
     */
    ImportSnapshot snapshot(ImportTransaction tx, String projectId, ImportLedger ledger) {
        Set<String> anchored = repository.anchoredStepIds(tx, ledger.stepIds());
        List<ImportSnapshot.StepView> steps = new ArrayList<>();
        for (String stepId : ledger.stepIds()) {
            repository.findStep(tx, stepId).ifPresent(state -> steps.add(new ImportSnapshot.StepView(
                state.stepId(), state.status(), state.qaStatus(), anchored.contains(state.stepId()))));
        }
        return new ImportSnapshot(projectId, steps, ledger.logViews());
    }

    private void writePhase(ImportTransaction tx, String projectId, PhaseData phase, String submittedBy,
                            ImportLedger ledger) {
        repository.upsertPhase(tx, new PhaseRow(
            phase.phaseId(),
            projectId,
            phase.name(),
            StatusMapper.workStatus(phase.status()),
            phase.startedAt(),
            phase.completedAt()
        ));
        ledger.phaseWritten();
        for (StepData step : phase.phaseSteps()) {
            writeStep(tx, projectId, phase.phaseId(), step, submittedBy, ledger);
        }
    }

    private void writeStep(ImportTransaction tx, String projectId, String phaseId, StepData step,
                           String submittedBy, ImportLedger ledger) {
        repository.upsertStep(tx, new StepRow(
            step.stepId(),
            phaseId,
            projectId,
            step.name(),
            StatusMapper.stepStatus(step.status()),
            step.startedAt(),
            step.completedAt(),
            step.sdlcStage(),
            step.branchName(),
            step.commitId(),
            step.ciStatus(),
            step.qaStatus() != null ? StatusMapper.qaStatus(step.qaStatus()) : null,
            step.debugBranch(),
            step.issueLink(),
            step.pullRequest()
        ));
        ledger.stepWritten(step.stepId());
        for (GovernanceLogData entry : step.governanceLogs()) {
            writeGovernanceLog(tx, projectId, phaseId, step.stepId(), entry, submittedBy, ledger);
        }
    }

    private void writeGovernanceLog(ImportTransaction tx, String projectId, String phaseId, String stepId,
                                    GovernanceLogData data, String submittedBy, ImportLedger ledger) {
        EntryType type = StatusMapper.entryType(data.entryType());
        GovernanceLogEntry entry = new GovernanceLogEntry(
            data.logId(),
            type,
            data.timestamp(),
            submittedBy,
            data.summary(),
            GovernanceLogEntry.withOriginalEntryType(data.details(), data.entryType(), type),
            projectId,
            phaseId,
            stepId,
            data.memoryAnchor(),
            SOURCE_IMPORT
        );
        UpsertOutcome outcome = logStore.upsert(tx, entry);
        if (outcome != UpsertOutcome.UNCHANGED) {
            ledger.mutation(outcome.mutation(), entry);
        }
        ledger.governanceLogWritten(data.logId(), stepId, data.entryType());
    }

    static int completionPercentage(List<PhaseData> phases) {
        List<StepData> steps = phases.stream().flatMap(phase -> phase.phaseSteps().stream()).toList();
        if (steps.isEmpty()) {
            return 0;
        }
        long completed = steps.stream()
            .filter(step -> StatusMapper.stepStatus(step.status()) == StepStatus.COMPLETED)
            .count();
        return (int) Math.round(completed * 100.0 / steps.size());
    }
}
