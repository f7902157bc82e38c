package com.govsync.importer;

import com.govsync.contract.GovernanceLogData;
import com.govsync.contract.PhaseData;
import com.govsync.contract.StepData;
import com.govsync.contract.StepStatus;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the completed "debug" step added to a project whose steps carry debug artifacts
 * (debug branch, pull request or issue link), so that debugging work is tracked in the
 * hierarchy.
 */
@Component
public class DebugStepSynthesizer {

    static final String STEP_SUFFIX = "-DEBUG-AUTO";
    static final String LOG_SUFFIX = "-DEBUG-LOG";

    /**
     * @param at timestamp for the generated step and log; pass a value derived from the
     *           payload so that re-importing the same bundle writes identical rows
     */
    public Optional<StepData> synthesize(String projectId, List<PhaseData> phases, Instant at) {
        if (phases.isEmpty()) {
            return Optional.empty();
        }
        String stepId = projectId + STEP_SUFFIX;
        List<StepData> steps = phases.stream().flatMap(phase -> phase.phaseSteps().stream()).toList();
        boolean alreadyPresent = steps.stream().anyMatch(step -> stepId.equals(step.stepId()));
        if (alreadyPresent || steps.stream().noneMatch(StepData::hasDebugArtifacts)) {
            return Optional.empty();
        }
        GovernanceLogData entry = new GovernanceLogData(
            projectId + LOG_SUFFIX,
            "system",
            "Auto-created debug step during import for SDLC hygiene",
            at,
            null,
            Map.of("generated", true)
        );
        return Optional.of(new StepData(
            stepId,
            "Auto-Generated Debug Step",
            StepStatus.COMPLETED.getValue(),
            at,
            at,
            "debug",
            null,
            null,
            null,
            null,
            "auto-generated",
            null,
            null,
            List.of(entry)
        ));
    }
}
