package com.govsync.trigger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Endpoint for agents without a configured URL: the action is only logged. */
public class LoggingAutomationEndpoint implements AutomationEndpoint {

    private static final Logger log = LoggerFactory.getLogger(LoggingAutomationEndpoint.class);

    @Override
    public void invoke(AutomationAction action) {
        log.info("{} triggered for project {}: {} (subjects={})",
            action.agent(), action.projectId(), action.reason(), action.subjectIds());
    }
}
