package com.govsync.distribution;

import com.govsync.bus.LogUpdateEvent;

/**
 * Callbacks from an open transport. Calls for one connection arrive in order on a single thread.
 */
public interface TransportListener {

    void onEvent(LogUpdateEvent event);

    /**
     * The connection ended without {@link GovernanceLogTransport#close()} being called.
     *
     * @param cause failure, or {@code null} for a clean remote close
     */
    void onClosed(Throwable cause);
}
