package com.govsync.contract;

import java.util.List;

/**
 * A validated project import: the project tree, submission metadata and an optional
 * memory-anchor section processed after the tree in the same transaction.
 */
public record ProjectBundle(
    ProjectData project,
    SubmissionMeta meta,
    List<MemoryAnchorData> memoryAnchors
) {

    public ProjectBundle {
        memoryAnchors = memoryAnchors == null ? List.of() : List.copyOf(memoryAnchors);
    }

    public String submittedBy() {
        return meta != null ? meta.submittedBy() : null;
    }

    public int stepCount() {
        return project.phases().stream().mapToInt(p -> p.phaseSteps().size()).sum();
    }
}
