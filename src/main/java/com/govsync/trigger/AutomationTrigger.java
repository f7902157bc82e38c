package com.govsync.trigger;

/**
 * A predicate over an import snapshot bound to one downstream agent.
 */
public interface AutomationTrigger {

    String agent();

    TriggerDecision decide(ImportSnapshot snapshot);
}
