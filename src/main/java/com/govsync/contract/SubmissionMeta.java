package com.govsync.contract;

import java.time.Instant;
import java.util.List;

public record SubmissionMeta(
    String submissionType,
    String submittedBy,
    Instant submissionTimestamp,
    String targetSystem,
    String priority,
    List<String> tags
) {

    public SubmissionMeta {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
