package com.govsync.trigger;

import java.time.Instant;
import java.util.List;

/** What an agent endpoint is asked to do. Serialized as the JSON body of HTTP endpoints. */
public record AutomationAction(
    String agent,
    String projectId,
    String payloadHash,
    String reason,
    List<String> subjectIds,
    Instant requestedAt
) {
}
