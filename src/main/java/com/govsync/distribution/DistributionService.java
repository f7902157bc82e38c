package com.govsync.distribution;

import com.govsync.bus.GovernanceLogEntry;
import com.govsync.bus.LogUpdateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Client that keeps observers current with governance-log changes over the best available
 * transport.
 * <p>
 * {@link #connect()} walks the ladder WebSocket, SSE, polling and settles on the first tier
 * that opens. When an open push connection drops, the same tier is retried after an
 * exponential delay; a connection that stays up for the stability window resets the
 * attempt counter, and running out of attempts switches to polling for the rest of the
 * session. Events carry server sequence numbers and only sequences above the last
 * delivered one are passed on, so tier changes and replays never duplicate or reorder.
 * <p>
 * Connection work runs on the scheduler handed in, which this service owns and shuts down
 * in {@link #close()}. Each subscriber has its own serial executor.
 */
public class DistributionService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DistributionService.class);

    private static final int WARM_CACHE_LIMIT = 1000;

    private final Map<TransportTier, GovernanceLogTransport> transports;
    private final ChangeFeedClient feed;
    private final GovernanceLogCache cache;
    private final ReconnectPolicy policy;
    private final Duration stableWindow;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Subscriber> subscribers = new ConcurrentHashMap<>();
    private final List<Consumer<ConnectionStatus>> statusListeners = new CopyOnWriteArrayList<>();
    private final ExecutorService statusNotifier = Executors.newSingleThreadExecutor(daemon("distribution-status"));

    // guarded by lock
    private long generation;
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private TransportTier tier;
    private GovernanceLogTransport activeTransport;
    private long connectionId;
    private int reconnectAttempts;
    private boolean permanentPolling;
    private long lastDeliveredSequence;
    private ScheduledFuture<?> reconnectTask;
    private ScheduledFuture<?> stabilityTask;
    private boolean closed;

    public DistributionService(Map<TransportTier, GovernanceLogTransport> transports,
                               ChangeFeedClient feed,
                               GovernanceLogCache cache,
                               ReconnectPolicy policy,
                               Duration stableWindow,
                               ScheduledExecutorService scheduler,
                               Clock clock) {
        this.transports = new EnumMap<>(transports);
        if (!this.transports.containsKey(TransportTier.POLLING)) {
            throw new IllegalArgumentException("a polling transport is required");
        }
        this.feed = feed;
        this.cache = cache;
        this.policy = policy;
        this.stableWindow = stableWindow;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * Starts connecting from the best tier. Completes with the status reached; a no-op
     * returning the current status when already connected or connecting.
     */
    public CompletableFuture<ConnectionStatus> connect() {
        long gen;
        TransportTier start;
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("distribution service is closed");
            }
            if (state != ConnectionState.DISCONNECTED) {
                return CompletableFuture.completedFuture(statusLocked());
            }
            gen = ++generation;
            start = permanentPolling ? TransportTier.POLLING : firstAvailable(TransportTier.WEBSOCKET);
            moveTo(ConnectionState.CONNECTING, start);
        } finally {
            lock.unlock();
        }
        return CompletableFuture.supplyAsync(() -> openLadder(gen, start), scheduler);
    }

    /**
     * Closes the transport and cancels pending reconnects and polling. Safe to call repeatedly.
     */
    public void disconnect() {
        GovernanceLogTransport transport;
        lock.lock();
        try {
            if (state == ConnectionState.DISCONNECTED && activeTransport == null) {
                return;
            }
            generation++;
            cancelTimers();
            transport = activeTransport;
            activeTransport = null;
            moveTo(ConnectionState.DISCONNECTED, null);
        } finally {
            lock.unlock();
        }
        if (transport != null) {
            transport.close();
        }
        log.info("Distribution client disconnected");
    }

    @Override
    public void close() {
        disconnect();
        lock.lock();
        try {
            closed = true;
        } finally {
            lock.unlock();
        }
        scheduler.shutdownNow();
        statusNotifier.shutdown();
        subscribers.values().forEach(subscriber -> subscriber.executor().shutdown());
        subscribers.clear();
    }

    /**
     * Registers an event consumer. Events reach it in sequence order on its own thread; a
     * slow or throwing consumer does not hold up the others.
     *
     * @return handle for {@link #unsubscribe}
     */
    public String subscribe(Consumer<LogUpdateEvent> consumer) {
        String id = UUID.randomUUID().toString();
        subscribers.put(id, new Subscriber(consumer, Executors.newSingleThreadExecutor(daemon("distribution-subscriber"))));
        return id;
    }

    public void unsubscribe(String id) {
        Subscriber removed = subscribers.remove(id);
        if (removed != null) {
            removed.executor().shutdown();
        }
    }

    public void addStatusListener(Consumer<ConnectionStatus> listener) {
        statusListeners.add(listener);
    }

    public void removeStatusListener(Consumer<ConnectionStatus> listener) {
        statusListeners.remove(listener);
    }

    public ConnectionStatus status() {
        lock.lock();
        try {
            return statusLocked();
        } finally {
            lock.unlock();
        }
    }

    public long lastDeliveredSequence() {
        lock.lock();
        try {
            return lastDeliveredSequence;
        } finally {
            lock.unlock();
        }
    }

    public GovernanceLogCache cache() {
        return cache;
    }

    /**
     * Loads the current entries into the cache. Call before {@link #connect()} so that
     * events delivered afterwards apply on top of a complete picture.
     */
    public void warmCache() throws TransportException {
        // read the cursor first; an event landing in between is applied twice, never lost
        long latest = feed.fetchChanges(Long.MAX_VALUE, 1).latestSequence();
        List<GovernanceLogEntry> entries = feed.fetchAll(WARM_CACHE_LIMIT);
        lock.lock();
        try {
            cache.replaceAll(entries);
            lastDeliveredSequence = Math.max(lastDeliveredSequence, latest);
        } finally {
            lock.unlock();
        }
        log.info("Cache warmed with {} governance logs up to sequence {}", entries.size(), latest);
    }

    // -- connection management, always on the scheduler thread --

    private ConnectionStatus openLadder(long gen, TransportTier start) {
        TransportTier candidate = start;
        while (candidate != null) {
            if (!isCurrent(gen)) {
                return status();
            }
            if (open(gen, candidate)) {
                return status();
            }
            candidate = nextAvailable(candidate);
        }
        // unreachable while a polling transport is registered, polling never fails to open
        return status();
    }

    /**
     * Opens {@code target} for generation {@code gen}.
     *
     * @return whether the connection is up and current
     */
    private boolean open(long gen, TransportTier target) {
        GovernanceLogTransport transport = transports.get(target);
        long id;
        long after;
        lock.lock();
        try {
            if (!isCurrentLocked(gen)) {
                return false;
            }
            id = ++connectionId;
            after = lastDeliveredSequence;
            activeTransport = transport;
            moveTo(ConnectionState.CONNECTING, target);
        } finally {
            lock.unlock();
        }
        try {
            transport.open(after, new ConnectionListener(gen, id, target));
        } catch (TransportException ex) {
            log.warn("{} transport failed to open: {}", target, ex.getMessage());
            clearActive(transport);
            return false;
        }
        lock.lock();
        try {
            if (!isCurrentLocked(gen) || connectionId != id || activeTransport != transport) {
                // superseded, or the connection dropped before open returned
                transport.close();
                return false;
            }
            moveTo(ConnectionState.CONNECTED, target);
            if (target.isPush()) {
                armStabilityTimer(gen, id);
            }
        } finally {
            lock.unlock();
        }
        log.info("Connected over {} from sequence {}", target, after);
        return true;
    }

    private void handleUnexpectedClose(long gen, long id, TransportTier closedTier, Throwable cause) {
        GovernanceLogTransport transport;
        lock.lock();
        try {
            if (!isCurrentLocked(gen) || connectionId != id || activeTransport == null) {
                return;
            }
            if (state != ConnectionState.CONNECTED) {
                // still inside open(), which sees the cleared transport and reports the failure
                activeTransport = null;
                return;
            }
            transport = activeTransport;
            activeTransport = null;
            cancelTimers();
            scheduleReconnectLocked(gen, closedTier);
        } finally {
            lock.unlock();
        }
        if (transport != null) {
            transport.close();
        }
        log.warn("{} connection lost{}", closedTier, cause != null ? ": " + cause.getMessage() : "");
    }

    private void scheduleReconnectLocked(long gen, TransportTier target) {
        if (policy.exhausted(reconnectAttempts)) {
            permanentPolling = true;
            log.warn("Giving up push transports after {} reconnect attempts, polling for the rest of the session",
                reconnectAttempts);
            moveTo(ConnectionState.CONNECTING, TransportTier.POLLING);
            scheduler.execute(() -> open(gen, TransportTier.POLLING));
            return;
        }
        Duration delay = policy.delayFor(reconnectAttempts);
        reconnectAttempts++;
        moveTo(ConnectionState.CONNECTING, target);
        log.info("Reconnecting over {} in {}ms (attempt {}/{})", target, delay.toMillis(),
            reconnectAttempts, policy.maxAttempts());
        reconnectTask = scheduler.schedule(() -> reconnect(gen, target), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void reconnect(long gen, TransportTier target) {
        if (open(gen, target)) {
            return;
        }
        lock.lock();
        try {
            if (isCurrentLocked(gen)) {
                scheduleReconnectLocked(gen, target);
            }
        } finally {
            lock.unlock();
        }
    }

    private void armStabilityTimer(long gen, long id) {
        stabilityTask = scheduler.schedule(() -> {
            lock.lock();
            try {
                if (isCurrentLocked(gen) && connectionId == id && state == ConnectionState.CONNECTED
                    && reconnectAttempts != 0) {
                    log.info("{} connection stable, reconnect attempts reset", tier);
                    reconnectAttempts = 0;
                    moveTo(ConnectionState.CONNECTED, tier);
                }
            } finally {
                lock.unlock();
            }
        }, stableWindow.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void clearActive(GovernanceLogTransport transport) {
        lock.lock();
        try {
            if (activeTransport == transport) {
                activeTransport = null;
            }
        } finally {
            lock.unlock();
        }
    }

    // -- delivery --

    private void deliver(long gen, long id, LogUpdateEvent event) {
        lock.lock();
        try {
            if (!isCurrentLocked(gen) || connectionId != id) {
                return;
            }
            if (event.sequence() <= lastDeliveredSequence) {
                log.debug("Skipping already delivered sequence {}", event.sequence());
                return;
            }
            lastDeliveredSequence = event.sequence();
            cache.apply(event);
            // enqueue under the lock so every subscriber sees sequences in order
            subscribers.forEach((subscriberId, subscriber) -> dispatch(subscriberId, subscriber, event));
        } finally {
            lock.unlock();
        }
    }

    private void dispatch(String subscriberId, Subscriber subscriber, LogUpdateEvent event) {
        try {
            subscriber.executor().execute(() -> {
                try {
                    subscriber.consumer().accept(event);
                } catch (Exception ex) {
                    log.warn("Subscriber {} failed on sequence {}: {}", subscriberId, event.sequence(), ex.getMessage());
                }
            });
        } catch (RejectedExecutionException ex) {
            log.debug("Subscriber {} already removed", subscriberId);
        }
    }

    // -- state helpers, callers hold the lock --

    private void moveTo(ConnectionState newState, TransportTier newTier) {
        state = newState;
        tier = newTier;
        ConnectionStatus status = statusLocked();
        for (Consumer<ConnectionStatus> listener : statusListeners) {
            try {
                statusNotifier.execute(() -> notifyListener(listener, status));
            } catch (RejectedExecutionException ex) {
                log.debug("Status notifier stopped, dropping {}", status.state());
            }
        }
    }

    private void notifyListener(Consumer<ConnectionStatus> listener, ConnectionStatus status) {
        try {
            listener.accept(status);
        } catch (Exception ex) {
            log.warn("Status listener failed: {}", ex.getMessage());
        }
    }

    private ConnectionStatus statusLocked() {
        return new ConnectionStatus(state, tier, reconnectAttempts, permanentPolling, clock.instant());
    }

    private void cancelTimers() {
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
        if (stabilityTask != null) {
            stabilityTask.cancel(false);
            stabilityTask = null;
        }
    }

    private boolean isCurrent(long gen) {
        lock.lock();
        try {
            return isCurrentLocked(gen);
        } finally {
            lock.unlock();
        }
    }

    private boolean isCurrentLocked(long gen) {
        return generation == gen && !closed;
    }

    private TransportTier firstAvailable(TransportTier from) {
        TransportTier candidate = from;
        while (candidate != null && !transports.containsKey(candidate)) {
            candidate = candidate.next();
        }
        return candidate;
    }

    private TransportTier nextAvailable(TransportTier from) {
        TransportTier next = from.next();
        return next == null ? null : firstAvailable(next);
    }

    private static ThreadFactory daemon(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }

    private record Subscriber(Consumer<LogUpdateEvent> consumer, ExecutorService executor) {
    }

    private final class ConnectionListener implements TransportListener {

        private final long gen;
        private final long id;
        private final TransportTier listenerTier;

        private ConnectionListener(long gen, long id, TransportTier listenerTier) {
            this.gen = gen;
            this.id = id;
            this.listenerTier = listenerTier;
        }

        @Override
        public void onEvent(LogUpdateEvent event) {
            deliver(gen, id, event);
        }

        @Override
        public void onClosed(Throwable cause) {
            try {
                scheduler.execute(() -> handleUnexpectedClose(gen, id, listenerTier, cause));
            } catch (RejectedExecutionException ex) {
                log.debug("Scheduler stopped, ignoring close of {}", listenerTier);
            }
        }
    }
}
