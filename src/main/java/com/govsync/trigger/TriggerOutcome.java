package com.govsync.trigger;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TriggerOutcome(String agent, boolean triggered, String reason, String error) {

    public static TriggerOutcome triggered(String agent, String reason) {
        return new TriggerOutcome(agent, true, reason, null);
    }

    public static TriggerOutcome idle(String agent, String reason) {
        return new TriggerOutcome(agent, false, reason, null);
    }

    public static TriggerOutcome failed(String agent, String reason, String error) {
        return new TriggerOutcome(agent, false, reason, error);
    }

    public boolean failed() {
        return error != null;
    }
}
