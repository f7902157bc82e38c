package com.govsync.trigger;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Requests a compliance audit when the import carries change, decision or architecture entries.
 * Matches the inbound entry type, so types without a canonical equivalent still count.
 */
public class AuditTrigger implements AutomationTrigger {

    public static final String AGENT = "AutoAuditAgent";

    private static final Set<String> AUDITABLE_TYPES = Set.of("change", "decision", "architecture");

    @Override
    public String agent() {
        return AGENT;
    }

    @Override
    public TriggerDecision decide(ImportSnapshot snapshot) {
        List<String> auditable = snapshot.governanceLogs().stream()
            .filter(entry -> entry.inboundEntryType() != null
                && AUDITABLE_TYPES.contains(entry.inboundEntryType().trim().toLowerCase(Locale.ROOT)))
            .map(ImportSnapshot.LogView::logId)
            .toList();
        if (auditable.isEmpty()) {
            return TriggerDecision.idle("No governance entries requiring audit");
        }
        return TriggerDecision.fire(
            "Found " + auditable.size() + " governance entries requiring compliance verification", auditable);
    }
}
