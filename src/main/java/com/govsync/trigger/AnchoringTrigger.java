package com.govsync.trigger;

import com.govsync.contract.QaStatus;
import com.govsync.contract.StepStatus;

import java.util.List;

public class AnchoringTrigger implements AutomationTrigger {

    public static final String AGENT = "MemoryAnchorAgent";

    @Override
    public String agent() {
        return AGENT;
    }

    @Override
    public TriggerDecision decide(ImportSnapshot snapshot) {
        List<String> ready = snapshot.steps().stream()
            .filter(step -> step.status() == StepStatus.COMPLETED && step.qaStatus() == QaStatus.PASSED)
            .map(ImportSnapshot.StepView::stepId)
            .toList();
        if (ready.isEmpty()) {
            return TriggerDecision.idle("No QA-complete steps ready for memory anchoring");
        }
        return TriggerDecision.fire(
            "Found " + ready.size() + " QA-complete steps ready for memory anchoring", ready);
    }
}
