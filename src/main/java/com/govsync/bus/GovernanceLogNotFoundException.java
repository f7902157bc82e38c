package com.govsync.bus;

public class GovernanceLogNotFoundException extends RuntimeException {

    private final String logId;

    public GovernanceLogNotFoundException(String logId) {
        super("governance log not found: " + logId);
        this.logId = logId;
    }

    public String getLogId() {
        return logId;
    }
}
