package com.govsync.bus;

import java.util.List;

/**
 * One page of the polling feed.
 *
 * @param oldestSequence lowest sequence still retained by the server; a client whose cursor
 *                       is below {@code oldestSequence - 1} has missed events and should reload
 */
public record ChangeFeedPage(List<LogUpdateEvent> events, long latestSequence, long oldestSequence) {

    public ChangeFeedPage {
        events = events == null ? List.of() : List.copyOf(events);
    }
}
