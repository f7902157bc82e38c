package com.govsync.distribution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.govsync.bus.LogUpdateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Primary push tier over {@code /ws/governance-logs}, one JSON event per text message.
 */
public class WebSocketTransport implements GovernanceLogTransport {

    private static final Logger log = LoggerFactory.getLogger(WebSocketTransport.class);

    private final URI endpoint;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration connectTimeout;

    private WebSocket webSocket;
    private Connection connection;

    public WebSocketTransport(URI endpoint, HttpClient httpClient, ObjectMapper objectMapper,
                              Duration connectTimeout) {
        this.endpoint = endpoint;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public TransportTier tier() {
        return TransportTier.WEBSOCKET;
    }

    @Override
    public void open(long afterSequence, TransportListener listener) throws TransportException {
        close();
        URI uri = URI.create(endpoint + "?after=" + afterSequence);
        Connection candidate = new Connection(listener);
        try {
            WebSocket socket = httpClient.newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .buildAsync(uri, candidate)
                .get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            synchronized (this) {
                webSocket = socket;
                connection = candidate;
            }
            log.info("WebSocket connected to {}", uri);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new TransportException(tier(), "WebSocket connect failed: " + cause.getMessage(), cause);
        } catch (TimeoutException ex) {
            throw new TransportException(tier(), "WebSocket connect timed out after " + connectTimeout.toMillis() + "ms", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TransportException(tier(), "WebSocket connect interrupted", ex);
        }
    }

    @Override
    public void close() {
        WebSocket socket;
        synchronized (this) {
            socket = webSocket;
            if (connection != null) {
                connection.closedLocally = true;
            }
            webSocket = null;
            connection = null;
        }
        if (socket != null && !socket.isOutputClosed()) {
            socket.sendClose(WebSocket.NORMAL_CLOSURE, "client disconnect")
                .whenComplete((ignored, ex) -> socket.abort());
        }
    }

    private final class Connection implements WebSocket.Listener {

        private final TransportListener listener;
        private final StringBuilder buffer = new StringBuilder();
        private volatile boolean closedLocally;

        private Connection(TransportListener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buffer.append(data);
            if (last) {
                String text = buffer.toString();
                buffer.setLength(0);
                if (!closedLocally) {
                    deliver(text);
                }
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            if (!closedLocally) {
                log.info("WebSocket closed by server ({} {})", statusCode, reason);
                listener.onClosed(null);
            }
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            if (!closedLocally) {
                log.warn("WebSocket failed: {}", error.getMessage());
                listener.onClosed(error);
            }
        }

        private void deliver(String text) {
            try {
                listener.onEvent(objectMapper.readValue(text, LogUpdateEvent.class));
            } catch (IOException ex) {
                log.warn("Dropping malformed WebSocket frame: {}", ex.getMessage());
            }
        }
    }
}
