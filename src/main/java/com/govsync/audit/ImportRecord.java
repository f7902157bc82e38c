package com.govsync.audit;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * One audited import attempt. {@code prevHash} and {@code hash} are filled in by the log
 * when the record is appended.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ImportRecord(
    String fingerprint,
    Instant timestamp,
    String operation,
    int recordCount,
    ImportStatus status,
    Map<String, Object> details,
    String errorMessage,
    String submittedBy,
    String prevHash,
    String hash
) {

    public ImportRecord {
        details = details == null ? Map.of() : details;
    }

    public static ImportRecord of(String fingerprint, Instant timestamp, String operation, int recordCount,
                                  ImportStatus status, Map<String, Object> details, String errorMessage,
                                  String submittedBy) {
        return new ImportRecord(fingerprint, timestamp, operation, recordCount, status, details,
            errorMessage, submittedBy, null, null);
    }

    ImportRecord chained(String prevHash, String hash) {
        return new ImportRecord(fingerprint, timestamp, operation, recordCount, status, details,
            errorMessage, submittedBy, prevHash, hash);
    }
}
