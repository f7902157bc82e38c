package com.govsync.distribution;

import java.time.Instant;

/**
 * Snapshot published to status listeners on every state change.
 *
 * @param tier              tier being connected or in use; {@code null} when disconnected
 * @param reconnectAttempts consecutive reconnect attempts since the last stable connection
 * @param permanentPolling  push tiers were given up for this session
 */
public record ConnectionStatus(
    ConnectionState state,
    TransportTier tier,
    int reconnectAttempts,
    boolean permanentPolling,
    Instant timestamp
) {

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }
}
