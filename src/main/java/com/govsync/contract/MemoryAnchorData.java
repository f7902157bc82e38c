package com.govsync.contract;

import java.time.Instant;
import java.util.List;

public record MemoryAnchorData(
    String anchorId,
    String linkedPhaseStepId,
    String status,
    String anchorType,
    String content,
    List<String> tags,
    Instant createdAt
) {

    public MemoryAnchorData {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
