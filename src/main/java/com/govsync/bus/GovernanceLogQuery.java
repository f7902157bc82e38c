package com.govsync.bus;

import com.govsync.contract.EntryType;

/**
 * Filter for listing stored entries. {@code null} fields do not constrain the result.
 */
public record GovernanceLogQuery(
    String projectId,
    String phaseId,
    String stepId,
    EntryType entryType,
    String actor,
    int limit
) {

    public static GovernanceLogQuery forStep(String stepId) {
        return new GovernanceLogQuery(null, null, stepId, null, null, 1000);
    }
}
