package com.govsync.distribution;

import com.govsync.bus.ChangeFeedPage;
import com.govsync.bus.GovernanceLogEntry;

import java.util.List;

/** Request/response access to the server's governance-log read endpoints. */
public interface ChangeFeedClient {

    ChangeFeedPage fetchChanges(long afterSequence, int limit) throws TransportException;

    List<GovernanceLogEntry> fetchAll(int limit) throws TransportException;
}
