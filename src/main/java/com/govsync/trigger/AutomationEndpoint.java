package com.govsync.trigger;

/**
 * Downstream agent that receives triggered actions.
 */
@FunctionalInterface
public interface AutomationEndpoint {

    /**
     * @throws TriggerException when the agent could not be reached or rejected the action
     */
    void invoke(AutomationAction action);
}
