package com.govsync.importer;

/**
 * Entities written by one import. {@code total} counts the hierarchy (phases and steps);
 * governance entries and anchors are reported in their own counters.
 */
public record RecordCounts(int phases, int steps, int governanceLogs, int memoryAnchors, int total) {

    public static RecordCounts of(int phases, int steps, int governanceLogs, int memoryAnchors) {
        return new RecordCounts(phases, steps, governanceLogs, memoryAnchors, phases + steps);
    }
}
