package com.govsync.importer;

import com.govsync.bus.GovernanceLogEntry;
import com.govsync.bus.MutationType;
import com.govsync.trigger.ImportSnapshot;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Running record of what one import wrote: counters, the governance-log mutations to
 * publish after commit, and the ids the trigger snapshot is built from.
 * Confined to the importing thread.
 */
class ImportLedger {

    private int phases;
    private int steps;
    private int governanceLogs;
    private final List<String> anchorIds = new ArrayList<>();
    private final Set<String> linkedSteps = new LinkedHashSet<>();
    private final Set<String> stepIds = new LinkedHashSet<>();
    private final List<ImportSnapshot.LogView> logViews = new ArrayList<>();
    private final List<PendingMutation> mutations = new ArrayList<>();

    void phaseWritten() {
        phases++;
    }

    void stepWritten(String stepId) {
        steps++;
        stepIds.add(stepId);
    }

    void governanceLogWritten(String logId, String stepId, String inboundEntryType) {
        governanceLogs++;
        logViews.add(new ImportSnapshot.LogView(logId, stepId, inboundEntryType));
    }

    void anchorWritten(String anchorId, String stepId) {
        anchorIds.add(anchorId);
        linkedSteps.add(stepId);
    }

    void mutation(MutationType type, GovernanceLogEntry entry) {
        mutations.add(new PendingMutation(type, entry));
    }

    RecordCounts counts() {
        return RecordCounts.of(phases, steps, governanceLogs, anchorIds.size());
    }

    List<String> anchorIds() {
        return List.copyOf(anchorIds);
    }

    List<String> linkedSteps() {
        return List.copyOf(linkedSteps);
    }

    Set<String> stepIds() {
        return stepIds;
    }

    List<ImportSnapshot.LogView> logViews() {
        return logViews;
    }

    List<PendingMutation> mutations() {
        return List.copyOf(mutations);
    }

    record PendingMutation(MutationType type, GovernanceLogEntry entry) {
    }
}
