package com.govsync.trigger;

import com.govsync.contract.QaStatus;
import com.govsync.contract.StepStatus;

import java.util.List;

/**
 * Committed state of one import, as read back inside its transaction. Triggers decide
 * purely from this value.
 */
public record ImportSnapshot(
    String projectId,
    List<StepView> steps,
    List<LogView> governanceLogs
) {

    public ImportSnapshot {
        steps = steps == null ? List.of() : List.copyOf(steps);
        governanceLogs = governanceLogs == null ? List.of() : List.copyOf(governanceLogs);
    }

    /**
     * @param anchored the step has an anchor row or a governance log naming an anchor
     */
    public record StepView(String stepId, StepStatus status, QaStatus qaStatus, boolean anchored) {
    }

    /**
     * @param inboundEntryType the entry type exactly as the producer sent it
     */
    public record LogView(String logId, String stepId, String inboundEntryType) {
    }
}
