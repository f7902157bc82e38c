package com.govsync.trigger;

import com.govsync.contract.GovernanceImportException;

/**
 * An automation endpoint call failed. Reported in the trigger's outcome, never propagated
 * to the import caller.
 */
public class TriggerException extends GovernanceImportException {

    public TriggerException(String message) {
        super(message);
    }

    public TriggerException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "trigger";
    }
}
