package com.govsync.contract;

import java.util.List;

/** Phases appended to an existing project. */
public record PhaseBatch(String projectId, List<PhaseData> phases, String submittedBy) {

    public PhaseBatch {
        phases = List.copyOf(phases);
    }
}
