package com.govsync.contract;

import java.util.List;

public record MemoryAnchorBatch(List<MemoryAnchorData> memoryAnchors, String submittedBy) {

    public MemoryAnchorBatch {
        memoryAnchors = List.copyOf(memoryAnchors);
    }
}
