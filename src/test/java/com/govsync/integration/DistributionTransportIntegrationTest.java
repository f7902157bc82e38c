package com.govsync.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.govsync.bus.GovernanceLogDraft;
import com.govsync.bus.GovernanceLogEntry;
import com.govsync.bus.GovernanceLogService;
import com.govsync.bus.LogUpdateEvent;
import com.govsync.bus.MutationType;
import com.govsync.distribution.ConnectionStatus;
import com.govsync.distribution.DistributionService;
import com.govsync.distribution.GovernanceLogCache;
import com.govsync.distribution.GovernanceLogTransport;
import com.govsync.distribution.HttpChangeFeedClient;
import com.govsync.distribution.PollingTransport;
import com.govsync.distribution.ReconnectPolicy;
import com.govsync.distribution.SseTransport;
import com.govsync.distribution.TransportTier;
import com.govsync.distribution.WebSocketTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Client against a running server, one tier at a time: committed edits reach subscribers
 * and the client cache over WebSocket, SSE and polling alike.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class DistributionTransportIntegrationTest {

    @LocalServerPort int port;
    @Autowired GovernanceLogService logService;
    @Autowired ObjectMapper objectMapper;

    private DistributionService client;

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
    }

    @Test
    @DisplayName("WebSocket delivers create, update and delete")
    void webSocketTier() throws Exception {
        client = client(TransportTier.WEBSOCKET);
        assertDelivery(TransportTier.WEBSOCKET);
    }

    @Test
    @DisplayName("SSE delivers create, update and delete")
    void sseTier() throws Exception {
        client = client(TransportTier.SSE);
        assertDelivery(TransportTier.SSE);
    }

    @Test
    @DisplayName("Polling delivers create, update and delete")
    void pollingTier() throws Exception {
        client = client(TransportTier.POLLING);
        assertDelivery(TransportTier.POLLING);
    }

    @Test
    @DisplayName("Unreachable WebSocket endpoint demotes to SSE")
    void brokenWebSocketDemotes() throws Exception {
        HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
        ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2);
        URI base = URI.create("http://localhost:" + port);
        HttpChangeFeedClient feed = new HttpChangeFeedClient(base, http, objectMapper, Duration.ofSeconds(2));
        Map<TransportTier, GovernanceLogTransport> transports = new EnumMap<>(TransportTier.class);
        transports.put(TransportTier.WEBSOCKET, new WebSocketTransport(
            URI.create("ws://localhost:" + port + "/ws/no-such-endpoint"), http, objectMapper, Duration.ofSeconds(2)));
        transports.put(TransportTier.SSE, new SseTransport(
            URI.create(base + "/v1/governance-logs/stream"), http, objectMapper, Duration.ofSeconds(2)));
        transports.put(TransportTier.POLLING, new PollingTransport(feed, scheduler, Duration.ofMillis(200), 500));
        client = new DistributionService(transports, feed, new GovernanceLogCache(),
            new ReconnectPolicy(Duration.ofMillis(50), Duration.ofMillis(200), 2), Duration.ofSeconds(10),
            scheduler, Clock.systemUTC());

        ConnectionStatus status = client.connect().get(10, TimeUnit.SECONDS);

        assertEquals(TransportTier.SSE, status.tier());
    }

    private void assertDelivery(TransportTier expectedTier) throws Exception {
        List<LogUpdateEvent> received = new CopyOnWriteArrayList<>();
        client.subscribe(received::add);
        client.warmCache();

        ConnectionStatus status = client.connect().get(10, TimeUnit.SECONDS);
        assertEquals(expectedTier, status.tier());
        assertTrue(status.isConnected());

        GovernanceLogEntry created = logService.create(new GovernanceLogDraft("Decision",
            "Distribute over " + expectedTier, "dave", null, Map.of(), "P-dist", null, null, null));
        await(() -> client.cache().get(created.id()).isPresent());

        logService.update(created.id(), new GovernanceLogDraft("Decision",
            "Distribute over " + expectedTier + " (revised)", "dave", created.timestamp(), Map.of(), "P-dist",
            null, null, null));
        await(() -> client.cache().get(created.id())
            .map(entry -> entry.summary().endsWith("(revised)"))
            .orElse(false));

        logService.delete(created.id());
        await(() -> client.cache().get(created.id()).isEmpty());

        List<MutationType> types = received.stream()
            .filter(event -> event.log().id().equals(created.id()))
            .map(LogUpdateEvent::type)
            .toList();
        assertEquals(List.of(MutationType.CREATED, MutationType.UPDATED, MutationType.DELETED), types);

        List<Long> sequences = received.stream().map(LogUpdateEvent::sequence).toList();
        for (int i = 1; i < sequences.size(); i++) {
            assertTrue(sequences.get(i) > sequences.get(i - 1), "sequences must strictly increase");
        }
    }

    private DistributionService client(TransportTier only) {
        HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
        ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2);
        URI base = URI.create("http://localhost:" + port);
        HttpChangeFeedClient feed = new HttpChangeFeedClient(base, http, objectMapper, Duration.ofSeconds(2));
        Map<TransportTier, GovernanceLogTransport> transports = new EnumMap<>(TransportTier.class);
        if (only == TransportTier.WEBSOCKET) {
            transports.put(TransportTier.WEBSOCKET, new WebSocketTransport(
                URI.create("ws://localhost:" + port + "/ws/governance-logs"), http, objectMapper,
                Duration.ofSeconds(2)));
        }
        if (only == TransportTier.SSE) {
            transports.put(TransportTier.SSE, new SseTransport(
                URI.create(base + "/v1/governance-logs/stream"), http, objectMapper, Duration.ofSeconds(2)));
        }
        transports.put(TransportTier.POLLING, new PollingTransport(feed, scheduler, Duration.ofMillis(200), 500));
        return new DistributionService(transports, feed, new GovernanceLogCache(),
            new ReconnectPolicy(Duration.ofMillis(50), Duration.ofMillis(200), 2), Duration.ofSeconds(10),
            scheduler, Clock.systemUTC());
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 10s");
            }
            Thread.sleep(20);
        }
    }
}
