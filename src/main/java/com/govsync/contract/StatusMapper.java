package com.govsync.contract;

import java.util.Locale;
import java.util.Map;

/**
 * Maps producer-supplied status strings onto the canonical enumerations.
 *
 * Producers drift ("Active", "Complete", "In Progress", "QA Pass" ...), so the lookup is
 * normalised (lower case, spaces and underscores folded to dashes) and total: anything
 * unknown maps to the safe default of its enumeration instead of failing the import.
 */
public final class StatusMapper {

    private static final Map<String, WorkStatus> WORK_STATUSES = Map.ofEntries(
        Map.entry("planning", WorkStatus.PLANNING),
        Map.entry("planned", WorkStatus.PLANNING),
        Map.entry("not-started", WorkStatus.PLANNING),
        Map.entry("active", WorkStatus.IN_PROGRESS),
        Map.entry("in-progress", WorkStatus.IN_PROGRESS),
        Map.entry("inprogress", WorkStatus.IN_PROGRESS),
        Map.entry("started", WorkStatus.IN_PROGRESS),
        Map.entry("complete", WorkStatus.COMPLETED),
        Map.entry("completed", WorkStatus.COMPLETED),
        Map.entry("done", WorkStatus.COMPLETED),
        Map.entry("closed", WorkStatus.COMPLETED),
        Map.entry("on-hold", WorkStatus.ON_HOLD),
        Map.entry("hold", WorkStatus.ON_HOLD),
        Map.entry("paused", WorkStatus.ON_HOLD),
        Map.entry("blocked", WorkStatus.ON_HOLD)
    );

    private static final Map<String, StepStatus> STEP_STATUSES = Map.ofEntries(
        Map.entry("not-started", StepStatus.NOT_STARTED),
        Map.entry("planning", StepStatus.NOT_STARTED),
        Map.entry("pending", StepStatus.NOT_STARTED),
        Map.entry("todo", StepStatus.NOT_STARTED),
        Map.entry("active", StepStatus.IN_PROGRESS),
        Map.entry("in-progress", StepStatus.IN_PROGRESS),
        Map.entry("inprogress", StepStatus.IN_PROGRESS),
        Map.entry("started", StepStatus.IN_PROGRESS),
        Map.entry("blocked", StepStatus.BLOCKED),
        Map.entry("on-hold", StepStatus.BLOCKED),
        Map.entry("complete", StepStatus.COMPLETED),
        Map.entry("completed", StepStatus.COMPLETED),
        Map.entry("done", StepStatus.COMPLETED),
        Map.entry("error", StepStatus.ERROR),
        Map.entry("failed", StepStatus.ERROR)
    );

    private static final Map<String, QaStatus> QA_STATUSES = Map.ofEntries(
        Map.entry("pass", QaStatus.PASSED),
        Map.entry("passed", QaStatus.PASSED),
        Map.entry("complete", QaStatus.PASSED),
        Map.entry("completed", QaStatus.PASSED),
        Map.entry("qa-pass", QaStatus.PASSED),
        Map.entry("fail", QaStatus.FAILED),
        Map.entry("failed", QaStatus.FAILED),
        Map.entry("qa-fail", QaStatus.FAILED),
        Map.entry("in-progress", QaStatus.IN_PROGRESS),
        Map.entry("running", QaStatus.IN_PROGRESS),
        Map.entry("not-run", QaStatus.NOT_RUN),
        Map.entry("pending", QaStatus.NOT_RUN)
    );

    private static final Map<String, EntryType> ENTRY_TYPES = Map.ofEntries(
        Map.entry("review", EntryType.REVIEW),
        Map.entry("decision", EntryType.DECISION),
        Map.entry("change", EntryType.CHANGE),
        Map.entry("audit", EntryType.AUDIT),
        Map.entry("ai-session", EntryType.AI_SESSION),
        Map.entry("aisession", EntryType.AI_SESSION),
        Map.entry("system", EntryType.SYSTEM)
    );

    private StatusMapper() {
    }

    public static WorkStatus workStatus(String raw) {
        return WORK_STATUSES.getOrDefault(normalize(raw), WorkStatus.PLANNING);
    }

    public static StepStatus stepStatus(String raw) {
        return STEP_STATUSES.getOrDefault(normalize(raw), StepStatus.NOT_STARTED);
    }

    public static QaStatus qaStatus(String raw) {
        return QA_STATUSES.getOrDefault(normalize(raw), QaStatus.NOT_RUN);
    }

    public static EntryType entryType(String raw) {
        return ENTRY_TYPES.getOrDefault(normalize(raw), EntryType.SYSTEM);
    }

    static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim()
            .toLowerCase(Locale.ROOT)
            .replace('_', '-')
            .replace(' ', '-');
    }
}
