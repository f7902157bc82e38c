package com.govsync.distribution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.govsync.bus.LogUpdateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Secondary push tier: a {@code text/event-stream} response read line by line on a
 * dedicated reader thread. Only {@code data} fields of {@code log-update} events are used.
 */
public class SseTransport implements GovernanceLogTransport {

    private static final Logger log = LoggerFactory.getLogger(SseTransport.class);

    private static final String EVENT_NAME = "log-update";

    private final URI endpoint;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration connectTimeout;

    private Reader reader;

    public SseTransport(URI endpoint, HttpClient httpClient, ObjectMapper objectMapper, Duration connectTimeout) {
        this.endpoint = endpoint;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public TransportTier tier() {
        return TransportTier.SSE;
    }

    @Override
    public void open(long afterSequence, TransportListener listener) throws TransportException {
        close();
        HttpRequest request = HttpRequest.newBuilder(URI.create(endpoint + "?after=" + afterSequence))
            .header("Accept", "text/event-stream")
            .GET()
            .build();
        HttpResponse<InputStream> response;
        try {
            response = httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofInputStream())
                .get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new TransportException(tier(), "SSE connect failed: " + cause.getMessage(), cause);
        } catch (TimeoutException ex) {
            throw new TransportException(tier(), "SSE connect timed out after " + connectTimeout.toMillis() + "ms", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TransportException(tier(), "SSE connect interrupted", ex);
        }
        if (response.statusCode() != 200) {
            closeQuietly(response.body());
            throw new TransportException(tier(), "SSE endpoint returned HTTP " + response.statusCode());
        }
        Reader started = new Reader(response.body(), listener);
        synchronized (this) {
            reader = started;
        }
        started.thread.start();
        log.info("SSE stream opened at {}", request.uri());
    }

    @Override
    public void close() {
        Reader current;
        synchronized (this) {
            current = reader;
            reader = null;
        }
        if (current != null) {
            current.stop();
        }
    }

    private static void closeQuietly(InputStream body) {
        try {
            body.close();
        } catch (IOException ex) {
            log.debug("Closing SSE body failed: {}", ex.getMessage());
        }
    }

    private final class Reader implements Runnable {

        private final InputStream body;
        private final TransportListener listener;
        private final Thread thread;
        private volatile boolean stopped;

        private Reader(InputStream body, TransportListener listener) {
            this.body = body;
            this.listener = listener;
            this.thread = new Thread(this, "sse-reader");
            this.thread.setDaemon(true);
        }

        @Override
        public void run() {
            Throwable failure = null;
            try (BufferedReader lines = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8))) {
                String eventName = null;
                StringBuilder data = new StringBuilder();
                String line;
                while (!stopped && (line = lines.readLine()) != null) {
                    if (line.isEmpty()) {
                        dispatch(eventName, data);
                        eventName = null;
                        data.setLength(0);
                    } else if (line.startsWith(":")) {
                        continue;
                    } else if (line.startsWith("event:")) {
                        eventName = line.substring(6).trim();
                    } else if (line.startsWith("data:")) {
                        if (data.length() > 0) {
                            data.append('\n');
                        }
                        data.append(line.substring(5).stripLeading());
                    }
                }
            } catch (IOException ex) {
                failure = ex;
            }
            if (!stopped) {
                log.info("SSE stream ended{}", failure != null ? ": " + failure.getMessage() : "");
                listener.onClosed(failure);
            }
        }

        private void dispatch(String eventName, StringBuilder data) {
            if (data.length() == 0 || stopped) {
                return;
            }
            if (eventName != null && !EVENT_NAME.equals(eventName)) {
                return;
            }
            try {
                listener.onEvent(objectMapper.readValue(data.toString(), LogUpdateEvent.class));
            } catch (IOException ex) {
                log.warn("Dropping malformed SSE event: {}", ex.getMessage());
            }
        }

        private void stop() {
            stopped = true;
            closeQuietly(body);
            thread.interrupt();
        }
    }
}
