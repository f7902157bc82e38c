package com.govsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings under the {@code govsync} prefix.
 */
@Component
@ConfigurationProperties(prefix = "govsync")
public class GovSyncProperties {

    private Import importSettings = new Import();
    private Audit audit = new Audit();
    private Automation automation = new Automation();
    private Distribution distribution = new Distribution();
    private Client client = new Client();

    public Import getImport() { return importSettings; }
    public void setImport(Import importSettings) { this.importSettings = importSettings; }
    public Audit getAudit() { return audit; }
    public void setAudit(Audit audit) { this.audit = audit; }
    public Automation getAutomation() { return automation; }
    public void setAutomation(Automation automation) { this.automation = automation; }
    public Distribution getDistribution() { return distribution; }
    public void setDistribution(Distribution distribution) { this.distribution = distribution; }
    public Client getClient() { return client; }
    public void setClient(Client client) { this.client = client; }

    public static class Import {
        /** Synthesize a completed debug step when any step carries debug artifacts. */
        private boolean debugStepEnabled = true;

        public boolean isDebugStepEnabled() { return debugStepEnabled; }
        public void setDebugStepEnabled(boolean debugStepEnabled) { this.debugStepEnabled = debugStepEnabled; }
    }

    public static class Audit {
        private String file = "data/import-audit.jsonl";
        private int recentLimit = 50;

        public String getFile() { return file; }
        public void setFile(String file) { this.file = file; }
        public int getRecentLimit() { return recentLimit; }
        public void setRecentLimit(int recentLimit) { this.recentLimit = recentLimit; }
    }

    public static class Automation {
        private Duration timeout = Duration.ofSeconds(5);
        private int maxAttempts = 3;
        private Duration retryBackoff = Duration.ofMillis(200);
        private int poolSize = 3;
        /** Agent name to endpoint URL. Agents without a URL only log their actions. */
        private Map<String, String> endpoints = new LinkedHashMap<>();

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getRetryBackoff() { return retryBackoff; }
        public void setRetryBackoff(Duration retryBackoff) { this.retryBackoff = retryBackoff; }
        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
        public Map<String, String> getEndpoints() { return endpoints; }
        public void setEndpoints(Map<String, String> endpoints) { this.endpoints = endpoints; }
    }

    public static class Distribution {
        private int journalCapacity = 1000;
        private Duration heartbeatInterval = Duration.ofSeconds(30);

        public int getJournalCapacity() { return journalCapacity; }
        public void setJournalCapacity(int journalCapacity) { this.journalCapacity = journalCapacity; }
        public Duration getHeartbeatInterval() { return heartbeatInterval; }
        public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }
    }

    public static class Client {
        private String baseUrl;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration baseReconnectDelay = Duration.ofSeconds(3);
        private Duration maxReconnectDelay = Duration.ofSeconds(60);
        private int maxReconnectAttempts = 5;
        private Duration pollingInterval = Duration.ofSeconds(30);
        private Duration stableConnectionWindow = Duration.ofSeconds(10);

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
        public Duration getBaseReconnectDelay() { return baseReconnectDelay; }
        public void setBaseReconnectDelay(Duration baseReconnectDelay) { this.baseReconnectDelay = baseReconnectDelay; }
        public Duration getMaxReconnectDelay() { return maxReconnectDelay; }
        public void setMaxReconnectDelay(Duration maxReconnectDelay) { this.maxReconnectDelay = maxReconnectDelay; }
        public int getMaxReconnectAttempts() { return maxReconnectAttempts; }
        public void setMaxReconnectAttempts(int maxReconnectAttempts) { this.maxReconnectAttempts = maxReconnectAttempts; }
        public Duration getPollingInterval() { return pollingInterval; }
        public void setPollingInterval(Duration pollingInterval) { this.pollingInterval = pollingInterval; }
        public Duration getStableConnectionWindow() { return stableConnectionWindow; }
        public void setStableConnectionWindow(Duration stableConnectionWindow) { this.stableConnectionWindow = stableConnectionWindow; }
    }
}
