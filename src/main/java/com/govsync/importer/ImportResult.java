package com.govsync.importer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.govsync.trigger.TriggerOutcome;

import java.time.Instant;
import java.util.List;

/**
 * Response of a successful import. Hierarchy imports fill {@code recordsImported} and
 * {@code agentTriggers}; anchor imports fill the anchor fields.
 *
 * @param auditRecorded present (and {@code false}) only when the audit record could not be written
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ImportResult(
    boolean success,
    String projectId,
    RecordCounts recordsImported,
    List<TriggerOutcome> agentTriggers,
    Integer anchorsImported,
    List<String> anchorIds,
    List<String> linkedSteps,
    String payloadHash,
    Instant timestamp,
    Boolean auditRecorded
) {

    static ImportResult hierarchy(String projectId, RecordCounts counts, List<TriggerOutcome> triggers,
                                  String payloadHash, Instant timestamp) {
        return new ImportResult(true, projectId, counts, triggers, null, null, null, payloadHash, timestamp, null);
    }

    static ImportResult anchors(List<String> anchorIds, List<String> linkedSteps, String payloadHash,
                                Instant timestamp) {
        return new ImportResult(true, null, null, null, anchorIds.size(), anchorIds, linkedSteps,
            payloadHash, timestamp, null);
    }

    ImportResult withAuditMissing() {
        return new ImportResult(success, projectId, recordsImported, agentTriggers, anchorsImported,
            anchorIds, linkedSteps, payloadHash, timestamp, Boolean.FALSE);
    }
}
