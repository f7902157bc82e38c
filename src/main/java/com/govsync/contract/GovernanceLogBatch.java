package com.govsync.contract;

import java.util.List;

/** Governance entries attached to an existing step. */
public record GovernanceLogBatch(String projectId, String phaseStepId,
                                 List<GovernanceLogData> governanceLogs, String submittedBy) {

    public GovernanceLogBatch {
        governanceLogs = List.copyOf(governanceLogs);
    }
}
