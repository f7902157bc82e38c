package com.govsync.contract;

import java.time.Instant;
import java.util.Map;

public record GovernanceLogData(
    String logId,
    String entryType,
    String summary,
    Instant timestamp,
    String memoryAnchor,
    Map<String, Object> details
) {

    public GovernanceLogData {
        details = details == null ? Map.of() : details;
    }
}
