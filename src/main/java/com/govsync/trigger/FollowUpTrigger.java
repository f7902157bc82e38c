package com.govsync.trigger;

import com.govsync.contract.StepStatus;

import java.util.List;

/**
 * Flags steps that still need attention: not completed, or completed without a memory anchor.
 */
public class FollowUpTrigger implements AutomationTrigger {

    public static final String AGENT = "SideQuestDetector";

    @Override
    public String agent() {
        return AGENT;
    }

    @Override
    public TriggerDecision decide(ImportSnapshot snapshot) {
        List<String> pending = snapshot.steps().stream()
            .filter(step -> step.status() != StepStatus.COMPLETED || !step.anchored())
            .map(ImportSnapshot.StepView::stepId)
            .toList();
        if (pending.isEmpty()) {
            return TriggerDecision.idle("All steps complete and properly anchored");
        }
        return TriggerDecision.fire(
            "Found " + pending.size() + " incomplete or unanchored steps requiring attention", pending);
    }
}
