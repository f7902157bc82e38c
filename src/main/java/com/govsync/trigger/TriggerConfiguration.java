package com.govsync.trigger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.govsync.config.GovSyncProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class TriggerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TriggerConfiguration.class);

    @Bean(destroyMethod = "shutdown")
    public ExecutorService automationExecutor(GovSyncProperties properties) {
        int size = Math.max(1, properties.getAutomation().getPoolSize());
        AtomicInteger counter = new AtomicInteger();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(size, size, 60, TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(256), runnable -> {
                Thread thread = new Thread(runnable, "automation-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    @Bean
    public AutomationEndpointRegistry automationEndpointRegistry(GovSyncProperties properties,
                                                                 ObjectMapper objectMapper) {
        GovSyncProperties.Automation automation = properties.getAutomation();
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(automation.getTimeout())
            .build();
        Map<String, AutomationEndpoint> endpoints = new LinkedHashMap<>();
        automation.getEndpoints().forEach((agent, url) -> {
            if (url != null && !url.isBlank()) {
                endpoints.put(agent, new HttpAutomationEndpoint(URI.create(url), httpClient, objectMapper,
                    automation.getTimeout()));
                log.info("Automation agent {} bound to {}", agent, url);
            }
        });
        return new AutomationEndpointRegistry(endpoints, new LoggingAutomationEndpoint());
    }

    @Bean
    public AutomationTriggerEvaluator automationTriggerEvaluator(AutomationEndpointRegistry registry,
                                                                 ExecutorService automationExecutor,
                                                                 GovSyncProperties properties,
                                                                 Clock clock) {
        GovSyncProperties.Automation automation = properties.getAutomation();
        return new AutomationTriggerEvaluator(
            List.of(new FollowUpTrigger(), new AuditTrigger(), new AnchoringTrigger()),
            registry,
            automationExecutor,
            automation.getTimeout(),
            automation.getMaxAttempts(),
            automation.getRetryBackoff(),
            clock
        );
    }
}
