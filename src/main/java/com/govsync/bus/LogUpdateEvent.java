package com.govsync.bus;

import java.time.Instant;

/**
 * One committed governance-log mutation. {@code sequence} is assigned by
 * {@link GovernanceLogBus} and strictly increases across all events of a server run.
 */
public record LogUpdateEvent(
    long sequence,
    MutationType type,
    GovernanceLogEntry log,
    Instant timestamp
) {
}
