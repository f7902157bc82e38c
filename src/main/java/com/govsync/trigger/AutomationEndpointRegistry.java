package com.govsync.trigger;

import java.util.Map;

/**
 * Resolves the endpoint for an agent name, falling back to a default endpoint.
 */
public class AutomationEndpointRegistry {

    private final Map<String, AutomationEndpoint> endpoints;
    private final AutomationEndpoint fallback;

    public AutomationEndpointRegistry(Map<String, AutomationEndpoint> endpoints, AutomationEndpoint fallback) {
        this.endpoints = Map.copyOf(endpoints);
        this.fallback = fallback;
    }

    public AutomationEndpoint endpointFor(String agent) {
        return endpoints.getOrDefault(agent, fallback);
    }
}
