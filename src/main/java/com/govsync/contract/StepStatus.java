package com.govsync.contract;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StepStatus {
    NOT_STARTED("not-started"),
    IN_PROGRESS("in-progress"),
    BLOCKED("blocked"),
    COMPLETED("completed"),
    ERROR("error");

    private final String value;

    StepStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Progress percentage stored alongside the step. */
    public int progress() {
        return switch (this) {
            case COMPLETED -> 100;
            case IN_PROGRESS -> 50;
            default -> 0;
        };
    }
}
