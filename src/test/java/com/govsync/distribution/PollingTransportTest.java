package com.govsync.distribution;

import com.govsync.bus.ChangeFeedPage;
import com.govsync.bus.GovernanceLogEntry;
import com.govsync.bus.LogUpdateEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class PollingTransportTest {

    private ScheduledExecutorService scheduler;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void drainsFullPagesAndAdvancesCursor() throws Exception {
        List<Long> cursors = new CopyOnWriteArrayList<>();
        ChangeFeedClient feed = new ChangeFeedClient() {
            @Override
            public ChangeFeedPage fetchChanges(long afterSequence, int limit) {
                cursors.add(afterSequence);
                if (afterSequence == 10) {
                    return page(11, 12);
                }
                if (afterSequence == 12) {
                    return page(13);
                }
                return page();
            }

            @Override
            public List<GovernanceLogEntry> fetchAll(int limit) {
                return List.of();
            }
        };
        List<Long> received = new CopyOnWriteArrayList<>();
        PollingTransport transport = new PollingTransport(feed, scheduler, Duration.ofMillis(20), 2);

        transport.open(10, recorder(received));
        waitFor(() -> received.size() == 3 && cursors.contains(13L));
        transport.close();

        assertEquals(List.of(11L, 12L, 13L), received);
        assertEquals(List.of(10L, 12L, 13L), cursors.subList(0, 3));
    }

    @Test
    void failedPollIsRetriedAtNextTick() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ChangeFeedClient feed = new ChangeFeedClient() {
            @Override
            public ChangeFeedPage fetchChanges(long afterSequence, int limit) throws TransportException {
                if (calls.incrementAndGet() == 1) {
                    throw new TransportException(TransportTier.POLLING, "HTTP 503");
                }
                return afterSequence == 0 ? page(1) : page();
            }

            @Override
            public List<GovernanceLogEntry> fetchAll(int limit) {
                return List.of();
            }
        };
        List<Long> received = new CopyOnWriteArrayList<>();
        PollingTransport transport = new PollingTransport(feed, scheduler, Duration.ofMillis(20), 10);

        transport.open(0, recorder(received));
        waitFor(() -> received.contains(1L));
        transport.close();

        assertTrue(calls.get() >= 2);
        assertEquals(TransportTier.POLLING, transport.tier());
    }

    private static TransportListener recorder(List<Long> received) {
        return new TransportListener() {
            @Override
            public void onEvent(LogUpdateEvent event) {
                received.add(event.sequence());
            }

            @Override
            public void onClosed(Throwable cause) {
                fail("polling never reports a close");
            }
        };
    }

    private static ChangeFeedPage page(long... sequences) {
        List<LogUpdateEvent> events = Arrays.stream(sequences)
            .mapToObj(sequence -> DistributionServiceTest.event(sequence, "L" + sequence))
            .toList();
        return new ChangeFeedPage(events, 100, 1);
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met in time");
            }
            Thread.sleep(10);
        }
    }
}
