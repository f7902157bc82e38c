package com.govsync.contract;

import com.fasterxml.jackson.annotation.JsonValue;

public enum QaStatus {
    NOT_RUN("not-run"),
    IN_PROGRESS("in-progress"),
    PASSED("passed"),
    FAILED("failed");

    private final String value;

    QaStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
