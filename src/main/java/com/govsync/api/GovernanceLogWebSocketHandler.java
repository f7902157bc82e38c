package com.govsync.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.govsync.bus.GovernanceLogBus;
import com.govsync.bus.LogUpdateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Push channel: one JSON text frame per {@link LogUpdateEvent}. The optional
 * {@code after} query parameter replays retained events above that sequence first.
 */
@Component
public class GovernanceLogWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(GovernanceLogWebSocketHandler.class);

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final GovernanceLogBus bus;
    private final ObjectMapper objectMapper;
    private final Map<String, String> subscriptions = new ConcurrentHashMap<>();

    public GovernanceLogWebSocketHandler(GovernanceLogBus bus, ObjectMapper objectMapper) {
        this.bus = bus;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession safeSession =
            new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        long after = afterParameter(session.getUri());
        String subscriptionId = bus.subscribe(after, event -> send(safeSession, event));
        subscriptions.put(session.getId(), subscriptionId);
        log.info("WebSocket session {} subscribed after sequence {}", session.getId(), after);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String subscriptionId = subscriptions.remove(session.getId());
        if (subscriptionId != null) {
            bus.unsubscribe(subscriptionId);
        }
        log.debug("WebSocket session {} closed: {}", session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("WebSocket session {} transport error: {}", session.getId(), exception.getMessage());
    }

    public int activeSessionCount() {
        return subscriptions.size();
    }

    private void send(WebSocketSession session, LogUpdateEvent event) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(event)));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("event " + event.sequence() + " is not serializable", ex);
        } catch (IOException ex) {
            throw new IllegalStateException("send to session " + session.getId() + " failed", ex);
        }
    }

    private long afterParameter(URI uri) {
        if (uri == null) {
            return bus.latestSequence();
        }
        String after = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst("after");
        if (after == null || after.isBlank()) {
            return bus.latestSequence();
        }
        try {
            return Long.parseLong(after.trim());
        } catch (NumberFormatException ex) {
            log.debug("Ignoring malformed after={} on session", after);
            return bus.latestSequence();
        }
    }
}
