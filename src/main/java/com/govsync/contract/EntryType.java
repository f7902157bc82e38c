package com.govsync.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EntryType {
    REVIEW("review"),
    DECISION("decision"),
    CHANGE("change"),
    AUDIT("audit"),
    AI_SESSION("ai-session"),
    SYSTEM("system");

    private final String value;

    EntryType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lenient wire decoding: anything unrecognised becomes {@link #SYSTEM}.
     */
    @JsonCreator
    public static EntryType fromValue(String raw) {
        return StatusMapper.entryType(raw);
    }
}
