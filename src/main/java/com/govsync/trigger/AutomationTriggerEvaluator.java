package com.govsync.trigger;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs every trigger against a committed import, concurrently and in isolation.
 *
 * Each trigger decides from the snapshot and, when it fires, calls its agent endpoint through
 * a per-agent {@link Retry} with a fixed wait between attempts. A trigger that throws, exceeds
 * its time budget or cannot be scheduled yields an outcome carrying the error; it never
 * affects the other triggers or the import itself.
 */
public class AutomationTriggerEvaluator {

    private static final Logger log = LoggerFactory.getLogger(AutomationTriggerEvaluator.class);

    static final String SATURATED = "automation executor saturated";

    private final List<AutomationTrigger> triggers;
    private final AutomationEndpointRegistry endpoints;
    private final ExecutorService executor;
    private final Duration attemptTimeout;
    private final int maxAttempts;
    private final Duration retryBackoff;
    private final RetryRegistry retries;
    private final Clock clock;

    public AutomationTriggerEvaluator(List<AutomationTrigger> triggers,
                                      AutomationEndpointRegistry endpoints,
                                      ExecutorService executor,
                                      Duration attemptTimeout,
                                      int maxAttempts,
                                      Duration retryBackoff,
                                      Clock clock) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.triggers = List.copyOf(triggers);
        this.endpoints = endpoints;
        this.executor = executor;
        this.attemptTimeout = attemptTimeout;
        this.maxAttempts = maxAttempts;
        this.retryBackoff = retryBackoff.isNegative() ? Duration.ZERO : retryBackoff;
        this.retries = RetryRegistry.of(RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .waitDuration(this.retryBackoff)
            .build());
        this.clock = clock;
        for (AutomationTrigger trigger : this.triggers) {
            retries.retry(trigger.agent()).getEventPublisher()
                .onRetry(event -> log.warn("{} attempt {}/{} failed: {}", event.getName(),
                    event.getNumberOfRetryAttempts(), maxAttempts,
                    event.getLastThrowable() == null ? null : event.getLastThrowable().getMessage()));
        }
    }

    /**
     * @return one outcome per trigger, in registration order
     */
    public List<TriggerOutcome> evaluate(ImportSnapshot snapshot, String payloadHash) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        long budgetMillis = triggerBudget().toMillis();

        List<CompletableFuture<TriggerOutcome>> futures = new ArrayList<>();
        for (AutomationTrigger trigger : triggers) {
            CompletableFuture<TriggerOutcome> future;
            try {
                future = CompletableFuture
                    .supplyAsync(() -> withMdc(mdc, () -> run(trigger, snapshot, payloadHash)), executor)
                    .orTimeout(budgetMillis, TimeUnit.MILLISECONDS)
                    .exceptionally(ex -> failure(trigger, ex));
            } catch (RejectedExecutionException ex) {
                log.warn("{} not scheduled: {}", trigger.agent(), ex.getMessage());
                future = CompletableFuture.completedFuture(
                    TriggerOutcome.failed(trigger.agent(), null, SATURATED));
            }
            futures.add(future);
        }
        return futures.stream().map(CompletableFuture::join).toList();
    }

    public List<String> agents() {
        return triggers.stream().map(AutomationTrigger::agent).toList();
    }

    private TriggerOutcome run(AutomationTrigger trigger, ImportSnapshot snapshot, String payloadHash) {
        TriggerDecision decision = trigger.decide(snapshot);
        if (!decision.fire()) {
            log.debug("{} not triggered: {}", trigger.agent(), decision.reason());
            return TriggerOutcome.idle(trigger.agent(), decision.reason());
        }
        AutomationAction action = new AutomationAction(trigger.agent(), snapshot.projectId(), payloadHash,
            decision.reason(), decision.subjectIds(), clock.instant());
        AutomationEndpoint endpoint = endpoints.endpointFor(trigger.agent());
        try {
            Retry.decorateRunnable(retries.retry(trigger.agent()), () -> endpoint.invoke(action)).run();
        } catch (RuntimeException ex) {
            log.warn("{} failed after {} attempt(s): {}", trigger.agent(), maxAttempts, ex.getMessage());
            return TriggerOutcome.failed(trigger.agent(), decision.reason(), ex.getMessage());
        }
        log.info("{} triggered for project {}: {}", trigger.agent(), snapshot.projectId(), decision.reason());
        return TriggerOutcome.triggered(trigger.agent(), decision.reason());
    }

    // every attempt may use its full timeout, plus the pauses between attempts
    private Duration triggerBudget() {
        return attemptTimeout.multipliedBy(maxAttempts).plus(retryBackoff.multipliedBy(maxAttempts - 1L));
    }

    private TriggerOutcome failure(AutomationTrigger trigger, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        String message = cause instanceof TimeoutException
            ? "timed out after " + triggerBudget().toMillis() + " ms"
            : String.valueOf(cause.getMessage());
        log.warn("{} evaluation failed: {}", trigger.agent(), message);
        return TriggerOutcome.failed(trigger.agent(), null, message);
    }

    private static <T> T withMdc(Map<String, String> context, Supplier<T> work) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (context != null) {
            MDC.setContextMap(context);
        }
        try {
            return work.get();
        } finally {
            if (previous != null) {
                MDC.setContextMap(previous);
            } else {
                MDC.clear();
            }
        }
    }
}
