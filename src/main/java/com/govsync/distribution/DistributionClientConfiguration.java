package com.govsync.distribution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.govsync.config.GovSyncProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires a {@link DistributionService} against a remote server when
 * {@code govsync.client.base-url} is set.
 */
@Configuration
@ConditionalOnProperty(prefix = "govsync.client", name = "base-url")
public class DistributionClientConfiguration {

    static final String WEBSOCKET_PATH = "/ws/governance-logs";
    static final String STREAM_PATH = "/v1/governance-logs/stream";
    private static final int POLL_PAGE_SIZE = 500;

    @Bean(destroyMethod = "close")
    public DistributionService distributionService(GovSyncProperties properties, ObjectMapper objectMapper,
                                                   Clock clock) {
        GovSyncProperties.Client client = properties.getClient();
        URI base = URI.create(stripTrailingSlash(client.getBaseUrl()));
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(client.getConnectTimeout())
            .build();

        AtomicInteger counter = new AtomicInteger();
        ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "distribution-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        ChangeFeedClient feed = new HttpChangeFeedClient(base, httpClient, objectMapper, client.getConnectTimeout());
        Map<TransportTier, GovernanceLogTransport> transports = new EnumMap<>(TransportTier.class);
        transports.put(TransportTier.WEBSOCKET, new WebSocketTransport(webSocketUri(base), httpClient, objectMapper,
            client.getConnectTimeout()));
        transports.put(TransportTier.SSE, new SseTransport(URI.create(base + STREAM_PATH), httpClient, objectMapper,
            client.getConnectTimeout()));
        transports.put(TransportTier.POLLING, new PollingTransport(feed, scheduler, client.getPollingInterval(),
            POLL_PAGE_SIZE));

        return new DistributionService(
            transports,
            feed,
            new GovernanceLogCache(),
            new ReconnectPolicy(client.getBaseReconnectDelay(), client.getMaxReconnectDelay(),
                client.getMaxReconnectAttempts()),
            client.getStableConnectionWindow(),
            scheduler,
            clock
        );
    }

    static URI webSocketUri(URI base) {
        String scheme = "https".equalsIgnoreCase(base.getScheme()) ? "wss" : "ws";
        String rest = base.toString().substring(base.getScheme().length());
        return URI.create(scheme + rest + WEBSOCKET_PATH);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
