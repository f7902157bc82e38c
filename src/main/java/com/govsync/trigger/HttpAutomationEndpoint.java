package com.govsync.trigger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Posts the action as JSON to an agent URL. Any non-2xx response is a failure.
 */
public class HttpAutomationEndpoint implements AutomationEndpoint {

    private static final Logger log = LoggerFactory.getLogger(HttpAutomationEndpoint.class);

    private final URI uri;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public HttpAutomationEndpoint(URI uri, HttpClient httpClient, ObjectMapper objectMapper,
                                  Duration requestTimeout) {
        this.uri = uri;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public void invoke(AutomationAction action) {
        String body;
        try {
            body = objectMapper.writeValueAsString(action);
        } catch (JsonProcessingException ex) {
            throw new TriggerException("could not serialize action for " + action.agent(), ex);
        }
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(requestTimeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new TriggerException(action.agent() + " endpoint returned HTTP " + response.statusCode());
            }
            log.debug("{} accepted action for project {}", action.agent(), action.projectId());
        } catch (IOException ex) {
            throw new TriggerException(action.agent() + " endpoint unreachable: " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TriggerException(action.agent() + " endpoint call interrupted", ex);
        }
    }

    public URI getUri() {
        return uri;
    }
}
