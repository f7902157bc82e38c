package com.govsync.importer;

public enum ImportKind {
    PROJECT("project-import", true),
    MEMORY_ANCHORS("memory-anchor-import", false),
    PHASES("phase-import", true),
    STEPS("step-import", true),
    GOVERNANCE_LOGS("governance-log-import", true);

    private final String operation;
    private final boolean triggersAutomation;

    ImportKind(String operation, boolean triggersAutomation) {
        this.operation = operation;
        this.triggersAutomation = triggersAutomation;
    }

    /** Name recorded in the audit trail and the logging context. */
    public String operation() {
        return operation;
    }

    public boolean triggersAutomation() {
        return triggersAutomation;
    }
}
