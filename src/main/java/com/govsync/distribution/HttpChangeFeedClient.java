package com.govsync.distribution;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.govsync.bus.ChangeFeedPage;
import com.govsync.bus.GovernanceLogEntry;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

public class HttpChangeFeedClient implements ChangeFeedClient {

    private static final TypeReference<List<GovernanceLogEntry>> ENTRY_LIST = new TypeReference<>() {};

    private final URI baseUri;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public HttpChangeFeedClient(URI baseUri, HttpClient httpClient, ObjectMapper objectMapper,
                                Duration requestTimeout) {
        this.baseUri = baseUri;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public ChangeFeedPage fetchChanges(long afterSequence, int limit) throws TransportException {
        String body = get("/v1/governance-logs/changes?after=" + afterSequence + "&limit=" + limit);
        try {
            return objectMapper.readValue(body, ChangeFeedPage.class);
        } catch (IOException ex) {
            throw new TransportException(TransportTier.POLLING, "malformed change feed page", ex);
        }
    }

    @Override
    public List<GovernanceLogEntry> fetchAll(int limit) throws TransportException {
        String body = get("/v1/governance-logs?limit=" + limit);
        try {
            return objectMapper.readValue(body, ENTRY_LIST);
        } catch (IOException ex) {
            throw new TransportException(TransportTier.POLLING, "malformed governance log listing", ex);
        }
    }

    private String get(String pathAndQuery) throws TransportException {
        HttpRequest request = HttpRequest.newBuilder(baseUri.resolve(pathAndQuery))
            .timeout(requestTimeout)
            .header("Accept", "application/json")
            .GET()
            .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new TransportException(TransportTier.POLLING,
                    "GET " + pathAndQuery + " returned HTTP " + response.statusCode());
            }
            return response.body();
        } catch (IOException ex) {
            throw new TransportException(TransportTier.POLLING, "GET " + pathAndQuery + " failed: " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TransportException(TransportTier.POLLING, "GET " + pathAndQuery + " interrupted", ex);
        }
    }
}
