package com.govsync.distribution;

/**
 * A transport could not be opened or failed while in use. Handled inside
 * {@link DistributionService} by demotion or reconnection.
 */
public class TransportException extends Exception {

    private final TransportTier tier;

    public TransportException(TransportTier tier, String message) {
        super(message);
        this.tier = tier;
    }

    public TransportException(TransportTier tier, String message, Throwable cause) {
        super(message, cause);
        this.tier = tier;
    }

    public TransportTier getTier() {
        return tier;
    }
}
