package com.govsync.distribution;

import com.govsync.bus.ChangeFeedPage;
import com.govsync.bus.LogUpdateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Last-resort tier: fetches the change feed at a fixed interval. Never fails to open;
 * a failed poll is logged and retried at the next tick.
 */
public class PollingTransport implements GovernanceLogTransport {

    private static final Logger log = LoggerFactory.getLogger(PollingTransport.class);

    private final ChangeFeedClient feed;
    private final ScheduledExecutorService scheduler;
    private final Duration interval;
    private final int pageSize;

    private ScheduledFuture<?> task;
    private long cursor;

    public PollingTransport(ChangeFeedClient feed, ScheduledExecutorService scheduler, Duration interval,
                            int pageSize) {
        this.feed = feed;
        this.scheduler = scheduler;
        this.interval = interval;
        this.pageSize = pageSize;
    }

    @Override
    public TransportTier tier() {
        return TransportTier.POLLING;
    }

    @Override
    public synchronized void open(long afterSequence, TransportListener listener) {
        close();
        cursor = afterSequence;
        task = scheduler.scheduleWithFixedDelay(() -> poll(listener), 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Polling change feed every {}ms after sequence {}", interval.toMillis(), afterSequence);
    }

    @Override
    public synchronized void close() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
    }

    private void poll(TransportListener listener) {
        try {
            ChangeFeedPage page;
            do {
                page = feed.fetchChanges(currentCursor(), pageSize);
                for (LogUpdateEvent event : page.events()) {
                    advance(event.sequence());
                    listener.onEvent(event);
                }
            } while (page.events().size() >= pageSize && isOpen());
        } catch (TransportException ex) {
            log.warn("Poll failed, retrying in {}ms: {}", interval.toMillis(), ex.getMessage());
        } catch (RuntimeException ex) {
            // an escaping exception would cancel the periodic task
            log.error("Poll tick failed", ex);
        }
    }

    private synchronized long currentCursor() {
        return cursor;
    }

    private synchronized void advance(long sequence) {
        cursor = Math.max(cursor, sequence);
    }

    private synchronized boolean isOpen() {
        return task != null;
    }
}
