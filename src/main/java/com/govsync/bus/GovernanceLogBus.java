package com.govsync.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Sequences committed governance-log mutations and fans them out.
 *
 * Publishing assigns the next sequence number, appends to a bounded journal used for
 * catch-up ({@link #since}) and hands the event to every subscriber's own serial executor.
 * Consumers run outside the bus lock: a slow or failing subscriber delays only itself, never
 * the publisher, the other subscribers or journal readers.
 */
public class GovernanceLogBus {

    private static final Logger log = LoggerFactory.getLogger(GovernanceLogBus.class);

    private final int journalCapacity;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong(0);
    private final Deque<LogUpdateEvent> journal = new ArrayDeque<>();
    private final Map<String, Subscriber> subscribers = new ConcurrentHashMap<>();
    private final AtomicInteger threadCounter = new AtomicInteger();

    public GovernanceLogBus(int journalCapacity, Clock clock) {
        if (journalCapacity <= 0) {
            throw new IllegalArgumentException("journalCapacity must be positive");
        }
        this.journalCapacity = journalCapacity;
        this.clock = clock;
    }

    public synchronized LogUpdateEvent publish(MutationType type, GovernanceLogEntry entry) {
        LogUpdateEvent event = new LogUpdateEvent(sequence.incrementAndGet(), type, entry, clock.instant());
        journal.addLast(event);
        while (journal.size() > journalCapacity) {
            journal.removeFirst();
        }
        log.debug("Published {} for governance log {} at sequence {}", type, entry.id(), event.sequence());
        // enqueue under the lock so every subscriber sees events in sequence order
        subscribers.forEach((id, subscriber) -> dispatch(id, subscriber, event));
        return event;
    }

    /** Journal events with a sequence above {@code after}, oldest first. */
    public synchronized List<LogUpdateEvent> since(long after, int limit) {
        List<LogUpdateEvent> result = new ArrayList<>();
        if (limit <= 0) {
            return result;
        }
        for (LogUpdateEvent event : journal) {
            if (event.sequence() > after) {
                result.add(event);
                if (result.size() >= limit) {
                    break;
                }
            }
        }
        return result;
    }

    /**
     * Registers a live subscriber after replaying every retained event above {@code after}.
     * Replay and registration happen under the publish lock, so no event falls between them.
     * Delivery is asynchronous; the consumer is always called on the subscription's own thread.
     *
     * @return subscription id for {@link #unsubscribe}
     */
    public synchronized String subscribe(long after, Consumer<LogUpdateEvent> consumer) {
        String id = UUID.randomUUID().toString();
        Subscriber subscriber = new Subscriber(consumer, Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "log-bus-subscriber-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }));
        for (LogUpdateEvent event : journal) {
            if (event.sequence() > after) {
                dispatch(id, subscriber, event);
            }
        }
        subscribers.put(id, subscriber);
        return id;
    }

    public void unsubscribe(String id) {
        Subscriber removed = subscribers.remove(id);
        if (removed != null) {
            removed.executor().shutdown();
        }
    }

    /** Stops every subscription's delivery thread. */
    public void close() {
        subscribers.keySet().forEach(this::unsubscribe);
    }

    public long latestSequence() {
        return sequence.get();
    }

    /** Lowest sequence still in the journal, or {@code latestSequence() + 1} when empty. */
    public synchronized long oldestRetainedSequence() {
        return journal.isEmpty() ? sequence.get() + 1 : journal.peekFirst().sequence();
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    private void dispatch(String id, Subscriber subscriber, LogUpdateEvent event) {
        try {
            subscriber.executor().execute(() -> {
                try {
                    subscriber.consumer().accept(event);
                } catch (Exception ex) {
                    log.warn("Subscriber {} failed for sequence {}: {}", id, event.sequence(), ex.getMessage());
                }
            });
        } catch (RejectedExecutionException ex) {
            log.debug("Subscriber {} already closed, dropping sequence {}", id, event.sequence());
        }
    }

    private record Subscriber(Consumer<LogUpdateEvent> consumer, ExecutorService executor) {
    }
}
