package com.govsync.distribution;

/** Transport ladder, best first. */
public enum TransportTier {
    WEBSOCKET,
    SSE,
    POLLING;

    public boolean isPush() {
        return this != POLLING;
    }

    /** The next tier down, or {@code null} below polling. */
    public TransportTier next() {
        return switch (this) {
            case WEBSOCKET -> SSE;
            case SSE -> POLLING;
            case POLLING -> null;
        };
    }
}
