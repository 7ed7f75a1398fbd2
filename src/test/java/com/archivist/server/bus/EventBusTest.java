package com.archivist.server.bus;

import com.archivist.server.enums.EventTypeEnum;
import com.archivist.server.model.api.systeminfo.ArchivistSettings;
import com.archivist.server.model.internal.ArchivistEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private static final Duration SHORT = Duration.ofMillis(50);

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        ArchivistSettings archivistSettings = new ArchivistSettings();
        archivistSettings.getEvents().setKeepaliveSec(1);
        archivistSettings.getEvents().setQueueCapacity(3);
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
        eventBus = new EventBus(archivistSettings, clock);
    }

    @Test
    void targetedPublishReachesOnlyTarget() throws InterruptedException {
        Subscriber alice = eventBus.subscribe("alice");
        Subscriber bob = eventBus.subscribe("bob");

        int delivered = eventBus.publish(EventTypeEnum.BACKUP_PROGRESS, Map.of("job_id", 1), "alice");

        assertEquals(1, delivered);
        ArchivistEvent event = alice.poll(SHORT);
        assertNotNull(event);
        assertEquals("backup_progress", event.getType());
        assertEquals(1, event.getData().get("job_id"));
        assertNull(bob.poll(SHORT));
    }

    @Test
    void broadcastSkipsUnsubscribed() throws InterruptedException {
        Subscriber alice = eventBus.subscribe("alice");
        Subscriber bob = eventBus.subscribe("bob");
        eventBus.unsubscribe("bob");

        int delivered = eventBus.publish(EventTypeEnum.SYSTEM_STATUS, Map.of("ok", true));

        assertEquals(1, delivered);
        assertNotNull(alice.poll(SHORT));
        assertNull(bob.poll(SHORT));
        assertFalse(bob.isActive());
        assertEquals(1, eventBus.getSubscriberCount());
    }

    @Test
    void publishToUnknownTargetIsNoop() {
        eventBus.subscribe("alice");

        assertEquals(0, eventBus.publish(EventTypeEnum.LOG_UPDATE, Map.of(), "nobody"));
        assertFalse(eventBus.isSubscribed("nobody"));
    }

    @Test
    void unsubscribeDropsPendingEvents() {
        Subscriber alice = eventBus.subscribe("alice");
        eventBus.publish(EventTypeEnum.LOG_UPDATE, Map.of("n", 1));
        assertEquals(1, alice.getPendingCount());

        eventBus.unsubscribe("alice");

        assertEquals(0, alice.getPendingCount());
        assertEquals(0, eventBus.publish(EventTypeEnum.LOG_UPDATE, Map.of("n", 2)));
    }

    @Test
    void resubscribeReplacesPreviousQueue() throws InterruptedException {
        Subscriber first = eventBus.subscribe("alice");
        eventBus.publish(EventTypeEnum.LOG_UPDATE, Map.of("n", 1));

        Subscriber second = eventBus.subscribe("alice");
        eventBus.publish(EventTypeEnum.LOG_UPDATE, Map.of("n", 2));

        assertFalse(first.isActive());
        assertEquals(1, eventBus.getSubscriberCount());
        ArchivistEvent event = second.poll(SHORT);
        assertNotNull(event);
        assertEquals(2, event.getData().get("n"));
        assertNull(second.poll(SHORT));
    }

    @Test
    void closingReplacedStreamKeepsNewSubscription() {
        EventStream old = eventBus.openStream("alice");
        EventStream current = eventBus.openStream("alice");

        old.close();

        assertTrue(eventBus.isSubscribed("alice"));
        assertTrue(current.isOpen());
        current.close();
        assertFalse(eventBus.isSubscribed("alice"));
    }

    @Test
    void fullQueueDropsOldest() throws InterruptedException {
        Subscriber alice = eventBus.subscribe("alice");
        for (int i = 1; i <= 5; i++) {
            eventBus.publish(EventTypeEnum.LOG_UPDATE, Map.of("n", i));
        }

        assertEquals(2, alice.getDroppedCount());
        List<Object> received = new ArrayList<>();
        ArchivistEvent event;
        while ((event = alice.poll(SHORT)) != null) {
            received.add(event.getData().get("n"));
        }
        assertEquals(List.of(3, 4, 5), received);
    }

    @Test
    void eventsArriveInPublishOrder() throws InterruptedException {
        Subscriber alice = eventBus.subscribe("alice");
        eventBus.publish(EventTypeEnum.BACKUP_PROGRESS, Map.of("n", 1));
        eventBus.publish(EventTypeEnum.BACKUP_PROGRESS, Map.of("n", 2));

        assertEquals(1, alice.poll(SHORT).getData().get("n"));
        assertEquals(2, alice.poll(SHORT).getData().get("n"));
    }

    @Test
    void streamStartsWithConnectionEstablishedThenFormatsEvents() throws InterruptedException {
        EventStream stream = eventBus.openStream("alice");

        String first = stream.next();
        assertTrue(first.startsWith("data: "));
        assertTrue(first.endsWith("\n\n"));
        assertTrue(first.contains("\"type\":\"connection_established\""));

        eventBus.publish(EventTypeEnum.BACKUP_PROGRESS, Map.of("job_id", 7, "status", "starting"), "alice");
        String frame = stream.next();
        assertTrue(frame.contains("\"type\":\"backup_progress\""));
        assertTrue(frame.contains("\"job_id\":7"));
        assertTrue(frame.contains("\"timestamp\":\"2024-05-01T12:00:00Z\""));
        stream.close();
    }

    @Test
    void idleStreamEmitsKeepaliveAndStaysOpen() throws InterruptedException {
        EventStream stream = eventBus.openStream("alice");
        stream.next();

        long start = System.nanoTime();
        String frame = stream.next();
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(EventStream.KEEPALIVE_FRAME, frame);
        assertTrue(elapsedMillis >= 900, "keepalive came too early: " + elapsedMillis);
        assertTrue(stream.isOpen());
        assertTrue(eventBus.isSubscribed("alice"));
        assertEquals(0, stream.getSubscriber().getPendingCount());
        stream.close();
    }

    @Test
    void concurrentSubscribeAndPublishDoNotInterfere() throws Exception {
        int threads = 8;
        ExecutorService executorService = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            String id = "user-" + t;
            futures.add(executorService.submit(() -> {
                start.await();
                for (int i = 0; i < 200; i++) {
                    eventBus.subscribe(id);
                    eventBus.publish(EventTypeEnum.LOG_UPDATE, Map.of("i", i));
                    eventBus.unsubscribe(id);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executorService.shutdown();

        assertEquals(0, eventBus.getSubscriberCount());
    }
}
