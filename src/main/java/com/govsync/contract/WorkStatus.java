package com.govsync.contract;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Canonical lifecycle of projects and phases.
 */
public enum WorkStatus {
    PLANNING("planning"),
    IN_PROGRESS("in-progress"),
    COMPLETED("completed"),
    ON_HOLD("on-hold");

    private final String value;

    WorkStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
