package com.govsync.distribution;

/**
 * One rung of the transport ladder. A transport carries at most one connection at a time
 * and can be reopened after {@link #close()}.
 */
public interface GovernanceLogTransport {

    TransportTier tier();

    /**
     * Opens a connection that delivers events with a sequence above {@code afterSequence}.
     * Blocks until the connection is established or the connect timeout expires.
     */
    void open(long afterSequence, TransportListener listener) throws TransportException;

    /** Closes the current connection, if any. No {@code onClosed} callback follows. */
    void close();
}
