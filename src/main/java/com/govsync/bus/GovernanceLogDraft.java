package com.govsync.bus;

import java.time.Instant;
import java.util.Map;

/**
 * Body of a direct create or update. Entry types are mapped leniently, like imports.
 */
public record GovernanceLogDraft(
    String entryType,
    String summary,
    String actor,
    Instant timestamp,
    Map<String, Object> details,
    String projectId,
    String phaseId,
    String stepId,
    String memoryAnchorId
) {
}
