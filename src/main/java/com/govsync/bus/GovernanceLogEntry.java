package com.govsync.bus;

import com.govsync.contract.EntryType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A governance log entry as stored and as distributed to observers.
 *
 * @param source where the entry came from ({@code import}, {@code api}, {@code system})
 */
public record GovernanceLogEntry(
    String id,
    EntryType entryType,
    Instant timestamp,
    String actor,
    String summary,
    Map<String, Object> details,
    String projectId,
    String phaseId,
    String stepId,
    String memoryAnchorId,
    String source
) {

    public GovernanceLogEntry {
        Objects.requireNonNull(id, "id");
        entryType = entryType == null ? EntryType.SYSTEM : entryType;
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /**
     * Keeps the producer's own entry-type spelling when it does not map one-to-one onto a
     * canonical type.
     */
    public static Map<String, Object> withOriginalEntryType(Map<String, Object> details, String raw, EntryType mapped) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (details != null) {
            result.putAll(details);
        }
        if (raw != null && !raw.isBlank() && !raw.trim().equalsIgnoreCase(mapped.getValue())) {
            result.put("originalEntryType", raw);
        }
        return result;
    }
}
