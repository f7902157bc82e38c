package com.govsync.contract;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ProjectData(
    String projectId,
    String name,
    String description,
    String programType,
    String status,
    Instant createdAt,
    Instant lastUpdated,
    Map<String, Object> metadata,
    List<PhaseData> phases
) {

    public ProjectData {
        metadata = metadata == null ? Map.of() : metadata;
        phases = phases == null ? List.of() : List.copyOf(phases);
    }
}
