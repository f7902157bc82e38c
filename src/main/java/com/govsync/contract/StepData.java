package com.govsync.contract;

import java.time.Instant;
import java.util.List;

/**
 * One phase step with its optional SDLC metadata. Absent SDLC fields are {@code null}
 * and leave the persisted values untouched on re-import.
 */
public record StepData(
    String stepId,
    String name,
    String status,
    Instant startedAt,
    Instant completedAt,
    String sdlcStage,
    String branchName,
    String commitId,
    String ciStatus,
    String qaStatus,
    String debugBranch,
    String issueLink,
    String pullRequest,
    List<GovernanceLogData> governanceLogs
) {

    public StepData {
        governanceLogs = governanceLogs == null ? List.of() : List.copyOf(governanceLogs);
    }

    public boolean hasDebugArtifacts() {
        return notBlank(debugBranch) || notBlank(pullRequest) || notBlank(issueLink);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
