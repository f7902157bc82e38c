package com.govsync.api;

import com.govsync.bus.GovernanceLogBus;
import com.govsync.bus.LogUpdateEvent;
import com.govsync.config.GovSyncProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link GovernanceLogBus} subscriptions to {@link SseEmitter}s.
 * <p>
 * Every event is sent with its sequence as the SSE id, so a reconnecting EventSource
 * resumes through {@code Last-Event-ID}. Heartbeat comments keep idle connections open
 * through proxies.
 */
@Service
public class GovernanceLogStreamService {

    private static final Logger log = LoggerFactory.getLogger(GovernanceLogStreamService.class);

    static final String EVENT_NAME = "log-update";

    private final GovernanceLogBus bus;
    private final Duration heartbeatInterval;
    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    public GovernanceLogStreamService(GovernanceLogBus bus, GovSyncProperties properties) {
        this.bus = bus;
        this.heartbeatInterval = properties.getDistribution().getHeartbeatInterval();
    }

    @PostConstruct
    void startHeartbeat() {
        long millis = heartbeatInterval.toMillis();
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats, millis, millis, TimeUnit.MILLISECONDS);
        log.info("SSE heartbeat scheduler started (interval={}ms)", millis);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        activeRegistrations.forEach(registration -> registration.emitter().complete());
    }

    /**
     * Opens a stream that first replays retained events above {@code after}, then follows
     * live mutations.
     */
    public SseEmitter createEmitter(long after) {
        SseEmitter emitter = new SseEmitter(0L);

        // comment first, so the client sees the stream is open before any replay
        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment: {}", e.getMessage());
        }

        String subscriptionId = bus.subscribe(after, event -> sendEvent(emitter, event));
        EmitterRegistration registration = new EmitterRegistration(subscriptionId, emitter);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> cleanup(registration));
        emitter.onError(ex -> {
            log.debug("SSE emitter {} error: {}", subscriptionId, ex.getMessage());
            cleanup(registration);
        });

        log.info("SSE stream {} opened after sequence {}", subscriptionId, after);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, LogUpdateEvent event) {
        try {
            emitter.send(SseEmitter.event()
                .id(Long.toString(event.sequence()))
                .name(EVENT_NAME)
                .data(event, MediaType.APPLICATION_JSON));
        } catch (IOException e) {
            log.debug("Failed to send sequence {}: {}", event.sequence(), e.getMessage());
            emitter.completeWithError(e);
        }
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                log.debug("Heartbeat failed for stream {}: {}", registration.subscriptionId(), e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for stream {} (emitter not active)", registration.subscriptionId());
            }
        }
    }

    private void cleanup(EmitterRegistration registration) {
        bus.unsubscribe(registration.subscriptionId());
        activeRegistrations.remove(registration);
        log.debug("Cleaned up SSE stream {}", registration.subscriptionId());
    }

    private record EmitterRegistration(String subscriptionId, SseEmitter emitter) {
    }
}
