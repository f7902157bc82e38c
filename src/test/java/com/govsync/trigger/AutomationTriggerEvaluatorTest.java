package com.govsync.trigger;

import com.govsync.contract.QaStatus;
import com.govsync.contract.StepStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AutomationTriggerEvaluatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void firingTriggersCallTheirEndpointOnce() {
        List<AutomationAction> received = new CopyOnWriteArrayList<>();
        AutomationTriggerEvaluator evaluator = evaluator(
            new AutomationEndpointRegistry(Map.of(), received::add), Duration.ofSeconds(1), 3);

        List<TriggerOutcome> outcomes = evaluator.evaluate(readySnapshot(), "hash-1");

        assertEquals(List.of("SideQuestDetector", "AutoAuditAgent", "MemoryAnchorAgent"),
            outcomes.stream().map(TriggerOutcome::agent).toList());
        assertTrue(outcomes.get(0).triggered());
        assertFalse(outcomes.get(1).triggered());
        assertNull(outcomes.get(1).error());
        assertTrue(outcomes.get(2).triggered());
        assertEquals(2, received.size());
        AutomationAction anchorAction = received.stream()
            .filter(action -> action.agent().equals(AnchoringTrigger.AGENT))
            .findFirst().orElseThrow();
        assertEquals("hash-1", anchorAction.payloadHash());
        assertEquals(List.of("S1"), anchorAction.subjectIds());
        assertEquals(CLOCK.instant(), anchorAction.requestedAt());
    }

    @Test
    void transientFailureIsRetried() {
        AtomicInteger calls = new AtomicInteger();
        AutomationEndpoint flaky = action -> {
            if (calls.incrementAndGet() == 1) {
                throw new TriggerException("connection reset");
            }
        };
        AutomationTriggerEvaluator evaluator = evaluator(
            new AutomationEndpointRegistry(Map.of(AnchoringTrigger.AGENT, flaky), action -> { }),
            Duration.ofSeconds(1), 3);

        TriggerOutcome outcome = outcomeFor(evaluator.evaluate(readySnapshot(), "h"), AnchoringTrigger.AGENT);

        assertTrue(outcome.triggered());
        assertFalse(outcome.failed());
        assertEquals(2, calls.get());
    }

    @Test
    void persistentFailureIsIsolated() {
        AutomationEndpoint broken = mock(AutomationEndpoint.class);
        doThrow(new TriggerException("agent down")).when(broken).invoke(any());
        AutomationTriggerEvaluator evaluator = evaluator(
            new AutomationEndpointRegistry(Map.of(AnchoringTrigger.AGENT, broken), action -> { }),
            Duration.ofSeconds(1), 2);

        List<TriggerOutcome> outcomes = evaluator.evaluate(readySnapshot(), "h");

        TriggerOutcome anchor = outcomeFor(outcomes, AnchoringTrigger.AGENT);
        assertFalse(anchor.triggered());
        assertEquals("agent down", anchor.error());
        assertTrue(outcomeFor(outcomes, FollowUpTrigger.AGENT).triggered());
        verify(broken, times(2)).invoke(any());
    }

    @Test
    void hangingEndpointTimesOut() {
        AutomationEndpoint hanging = action -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        };
        AutomationTriggerEvaluator evaluator = evaluator(
            new AutomationEndpointRegistry(Map.of(FollowUpTrigger.AGENT, hanging), action -> { }),
            Duration.ofMillis(100), 1);

        long started = System.nanoTime();
        List<TriggerOutcome> outcomes = evaluator.evaluate(readySnapshot(), "h");
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

        TriggerOutcome followUp = outcomeFor(outcomes, FollowUpTrigger.AGENT);
        assertTrue(followUp.failed());
        assertTrue(followUp.error().contains("timed out"));
        assertTrue(outcomeFor(outcomes, AnchoringTrigger.AGENT).triggered());
        assertTrue(elapsedMillis < 4_000, "evaluation should not wait for the hanging endpoint");
    }

    @Test
    void throwingTriggerYieldsFailedOutcome() {
        AutomationTrigger exploding = new AutomationTrigger() {
            @Override
            public String agent() {
                return "Exploding";
            }

            @Override
            public TriggerDecision decide(ImportSnapshot snapshot) {
                throw new IllegalStateException("boom");
            }
        };
        AutomationTriggerEvaluator evaluator = new AutomationTriggerEvaluator(
            List.of(exploding, new AnchoringTrigger()),
            new AutomationEndpointRegistry(Map.of(), action -> { }),
            executor, Duration.ofSeconds(1), 1, Duration.ZERO, CLOCK);

        List<TriggerOutcome> outcomes = evaluator.evaluate(readySnapshot(), "h");

        assertEquals("boom", outcomes.get(0).error());
        assertTrue(outcomes.get(1).triggered());
    }

    @Test
    void saturatedExecutorYieldsFailedOutcomesInsteadOfThrowing() throws InterruptedException {
        ThreadPoolExecutor busy = new ThreadPoolExecutor(1, 1, 0, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(1));
        CountDownLatch release = new CountDownLatch(1);
        Runnable blocker = () -> {
            try {
                release.await();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        };
        busy.execute(blocker);
        busy.execute(blocker);
        AutomationTriggerEvaluator evaluator = new AutomationTriggerEvaluator(
            List.of(new FollowUpTrigger(), new AuditTrigger(), new AnchoringTrigger()),
            new AutomationEndpointRegistry(Map.of(), action -> { }),
            busy, Duration.ofSeconds(1), 1, Duration.ZERO, CLOCK);

        try {
            List<TriggerOutcome> outcomes = evaluator.evaluate(readySnapshot(), "h");

            assertEquals(3, outcomes.size());
            assertTrue(outcomes.stream().allMatch(TriggerOutcome::failed));
            assertEquals(AutomationTriggerEvaluator.SATURATED, outcomes.get(0).error());
        } finally {
            release.countDown();
            busy.shutdown();
            busy.awaitTermination(1, TimeUnit.SECONDS);
        }
    }

    @Test
    void retryWaitsBetweenAttempts() {
        AtomicInteger calls = new AtomicInteger();
        AutomationEndpoint broken = action -> {
            calls.incrementAndGet();
            throw new TriggerException("agent down");
        };
        AutomationTriggerEvaluator evaluator = new AutomationTriggerEvaluator(
            List.of(new AnchoringTrigger()),
            new AutomationEndpointRegistry(Map.of(AnchoringTrigger.AGENT, broken), action -> { }),
            executor, Duration.ofSeconds(2), 3, Duration.ofMillis(100), CLOCK);

        long started = System.nanoTime();
        TriggerOutcome outcome = evaluator.evaluate(readySnapshot(), "h").get(0);
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

        assertTrue(outcome.failed());
        assertEquals(3, calls.get());
        assertTrue(elapsedMillis >= 200, "two waits of 100 ms expected, took " + elapsedMillis + " ms");
    }

    private AutomationTriggerEvaluator evaluator(AutomationEndpointRegistry registry, Duration timeout,
                                                 int maxAttempts) {
        return new AutomationTriggerEvaluator(
            List.of(new FollowUpTrigger(), new AuditTrigger(), new AnchoringTrigger()),
            registry, executor, timeout, maxAttempts, Duration.ofMillis(5), CLOCK);
    }

    private static TriggerOutcome outcomeFor(List<TriggerOutcome> outcomes, String agent) {
        return outcomes.stream().filter(outcome -> outcome.agent().equals(agent)).findFirst().orElseThrow();
    }

    // S1 is ready to anchor but not anchored yet; only a review entry
    private static ImportSnapshot readySnapshot() {
        return new ImportSnapshot("P1",
            List.of(new ImportSnapshot.StepView("S1", StepStatus.COMPLETED, QaStatus.PASSED, false)),
            List.of(new ImportSnapshot.LogView("L1", "S1", "Review")));
    }
}
