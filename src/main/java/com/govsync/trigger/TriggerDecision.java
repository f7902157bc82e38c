package com.govsync.trigger;

import java.util.List;

public record TriggerDecision(boolean fire, String reason, List<String> subjectIds) {

    public TriggerDecision {
        subjectIds = subjectIds == null ? List.of() : List.copyOf(subjectIds);
    }

    public static TriggerDecision fire(String reason, List<String> subjectIds) {
        return new TriggerDecision(true, reason, subjectIds);
    }

    public static TriggerDecision idle(String reason) {
        return new TriggerDecision(false, reason, List.of());
    }
}
