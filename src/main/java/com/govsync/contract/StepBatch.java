package com.govsync.contract;

import java.util.List;

/** Steps appended to an existing phase of an existing project. */
public record StepBatch(String projectId, String phaseId, List<StepData> phaseSteps, String submittedBy) {

    public StepBatch {
        phaseSteps = List.copyOf(phaseSteps);
    }
}
