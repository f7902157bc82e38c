package com.govsync.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ImportStatus {
    SUCCESS,
    ERROR,
    /** Committed, but at least one automation trigger reported an error. */
    PARTIAL;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ImportStatus fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
