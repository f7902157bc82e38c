package com.govsync.bus;

import com.govsync.contract.EntryType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class GovernanceLogBusTest {

    private GovernanceLogBus bus;

    @BeforeEach
    void setUp() {
        bus = new GovernanceLogBus(3, Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    @Test
    void sequencesStrictlyIncrease() {
        LogUpdateEvent first = bus.publish(MutationType.CREATED, entry("L1"));
        LogUpdateEvent second = bus.publish(MutationType.UPDATED, entry("L1"));

        assertEquals(1, first.sequence());
        assertEquals(2, second.sequence());
        assertEquals(2, bus.latestSequence());
    }

    @Test
    void journalIsBounded() {
        for (int i = 1; i <= 5; i++) {
            bus.publish(MutationType.CREATED, entry("L" + i));
        }

        assertEquals(3, bus.oldestRetainedSequence());
        assertEquals(List.of(3L, 4L, 5L), sequences(bus.since(0, 10)));
        assertEquals(List.of(5L), sequences(bus.since(4, 10)));
        assertEquals(List.of(3L), sequences(bus.since(0, 1)));
    }

    @Test
    void emptyJournalReportsNextSequenceAsOldest() {
        assertEquals(1, bus.oldestRetainedSequence());
        assertTrue(bus.since(0, 10).isEmpty());
    }

    @Test
    void subscribeReplaysThenFollows() throws InterruptedException {
        bus.publish(MutationType.CREATED, entry("L1"));
        bus.publish(MutationType.CREATED, entry("L2"));
        List<LogUpdateEvent> received = new CopyOnWriteArrayList<>();

        bus.subscribe(1, received::add);
        bus.publish(MutationType.DELETED, entry("L1"));

        await(() -> received.size() == 2);
        assertEquals(List.of(2L, 3L), sequences(received));
        assertEquals(MutationType.DELETED, received.get(1).type());
    }

    @Test
    void failingSubscriberDoesNotBlockOthers() throws InterruptedException {
        List<LogUpdateEvent> received = new CopyOnWriteArrayList<>();
        bus.subscribe(0, event -> {
            throw new IllegalStateException("subscriber broke");
        });
        bus.subscribe(0, received::add);

        bus.publish(MutationType.CREATED, entry("L1"));
        bus.publish(MutationType.CREATED, entry("L2"));

        await(() -> received.size() == 2);
        assertEquals(2, bus.subscriberCount());
    }

    @Test
    void slowSubscriberStallsNeitherPublisherNorOthersNorJournalReaders() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        bus.subscribe(0, event -> {
            try {
                release.await();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        });
        List<LogUpdateEvent> fast = new CopyOnWriteArrayList<>();
        for (int i = 0; i < 5; i++) {
            bus.subscribe(0, fast::add);
        }

        try {
            LogUpdateEvent published = CompletableFuture
                .supplyAsync(() -> bus.publish(MutationType.CREATED, entry("L1")))
                .get(2, TimeUnit.SECONDS);
            List<LogUpdateEvent> journal = CompletableFuture
                .supplyAsync(() -> bus.since(0, 10))
                .get(2, TimeUnit.SECONDS);

            assertEquals(1, published.sequence());
            assertEquals(List.of(1L), sequences(journal));
            await(() -> fast.size() == 5);
        } finally {
            release.countDown();
        }
    }

    @Test
    void eachSubscriberSeesSequenceOrder() throws InterruptedException {
        List<LogUpdateEvent> received = new CopyOnWriteArrayList<>();
        bus.subscribe(0, received::add);

        for (int i = 1; i <= 50; i++) {
            bus.publish(MutationType.CREATED, entry("L" + i));
        }

        await(() -> received.size() == 50);
        List<Long> seen = sequences(received);
        for (int i = 1; i < seen.size(); i++) {
            assertEquals(seen.get(i - 1) + 1, seen.get(i));
        }
    }

    @Test
    void unsubscribedConsumerStopsReceiving() throws InterruptedException {
        List<LogUpdateEvent> received = new CopyOnWriteArrayList<>();
        String id = bus.subscribe(0, received::add);
        bus.unsubscribe(id);

        bus.publish(MutationType.CREATED, entry("L1"));
        Thread.sleep(50);

        assertTrue(received.isEmpty());
        assertEquals(0, bus.subscriberCount());
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new GovernanceLogBus(0, Clock.systemUTC()));
    }

    static GovernanceLogEntry entry(String id) {
        return new GovernanceLogEntry(id, EntryType.REVIEW, Instant.parse("2024-01-01T00:00:00Z"), "alice",
            "summary " + id, Map.of(), "P1", "PH1", "S1", null, "api");
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    private static List<Long> sequences(List<LogUpdateEvent> events) {
        return events.stream().map(LogUpdateEvent::sequence).toList();
    }
}
