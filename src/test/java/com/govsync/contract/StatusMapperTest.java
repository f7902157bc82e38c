package com.govsync.contract;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class StatusMapperTest {

    @ParameterizedTest
    @CsvSource({
        "Active, IN_PROGRESS",
        "In Progress, IN_PROGRESS",
        "in_progress, IN_PROGRESS",
        "Complete, COMPLETED",
        "On Hold, ON_HOLD",
        "planning, PLANNING",
        "something-else, PLANNING"
    })
    void workStatus(String raw, WorkStatus expected) {
        assertEquals(expected, StatusMapper.workStatus(raw));
    }

    @ParameterizedTest
    @CsvSource({
        "Complete, COMPLETED",
        "DONE, COMPLETED",
        "Active, IN_PROGRESS",
        "failed, ERROR",
        "on hold, BLOCKED",
        "weird, NOT_STARTED"
    })
    void stepStatus(String raw, StepStatus expected) {
        assertEquals(expected, StatusMapper.stepStatus(raw));
    }

    @ParameterizedTest
    @CsvSource({
        "Pass, PASSED",
        "complete, PASSED",
        "QA Pass, PASSED",
        "Fail, FAILED",
        "running, IN_PROGRESS",
        "?, NOT_RUN"
    })
    void qaStatus(String raw, QaStatus expected) {
        assertEquals(expected, StatusMapper.qaStatus(raw));
    }

    @Test
    void entryType_unknownFallsBackToSystem() {
        assertEquals(EntryType.REVIEW, StatusMapper.entryType("Review"));
        assertEquals(EntryType.AI_SESSION, StatusMapper.entryType("AI Session"));
        assertEquals(EntryType.SYSTEM, StatusMapper.entryType("architecture"));
        assertEquals(EntryType.SYSTEM, StatusMapper.entryType(null));
    }

    @Test
    void stepProgress_followsStatus() {
        assertEquals(100, StepStatus.COMPLETED.progress());
        assertEquals(50, StepStatus.IN_PROGRESS.progress());
        assertEquals(0, StepStatus.BLOCKED.progress());
    }
}
