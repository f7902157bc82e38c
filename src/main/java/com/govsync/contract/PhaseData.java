package com.govsync.contract;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public record PhaseData(
    String phaseId,
    String name,
    String status,
    Instant startedAt,
    Instant completedAt,
    List<StepData> phaseSteps
) {

    public PhaseData {
        phaseSteps = phaseSteps == null ? List.of() : List.copyOf(phaseSteps);
    }

    public PhaseData withStepAppended(StepData step) {
        List<StepData> steps = new ArrayList<>(phaseSteps);
        steps.add(step);
        return new PhaseData(phaseId, name, status, startedAt, completedAt, steps);
    }
}
