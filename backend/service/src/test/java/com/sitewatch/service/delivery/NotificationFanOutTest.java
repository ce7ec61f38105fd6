package com.sitewatch.service.delivery;

import com.sitewatch.core.bus.EventBus;
import com.sitewatch.core.events.AlertRaised;
import com.sitewatch.core.events.NotificationDelivered;
import com.sitewatch.service.store.Subscriber;
import com.sitewatch.service.support.EventCapture;
import com.sitewatch.service.support.InMemoryDedupStore;
import com.sitewatch.service.support.MutableClock;
import com.sitewatch.service.support.RecordingTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotificationFanOutTest {
    private final ExecutorService pool = Executors.newFixedThreadPool(8);
    private final MutableClock clock = new MutableClock(Instant.parse("2026-02-09T20:00:00Z"), ZoneOffset.UTC);
    private final EventBus bus = new EventBus();
    private final EventCapture events = new EventCapture(bus);
    private final InMemoryDedupStore dedup = new InMemoryDedupStore();

    @AfterEach
    void stopPool() {
        pool.shutdownNow();
    }

    @Test
    void sendsToEveryReachableSubscriberAndSkipsThoseWithoutSession() {
        RecordingTransport transport = new RecordingTransport();
        NotificationFanOut fanOut = fanOut(transport, FanOutSettings.defaults());

        DeliveryReport report = fanOut.deliver("example", "Example Update #1", List.of(
                new Subscriber("u1", false, "s1"),
                new Subscriber("u2", false, null),
                new Subscriber("g1", true, "s3"),
                new Subscriber("u4", false, " ")
        ));

        assertFalse(report.duplicate());
        assertEquals(2, report.sent());
        assertEquals(0, report.failed());
        assertEquals(2, report.skippedWithoutSession());
        assertEquals(List.of("s1", "s3"), transport.sessionsFor("Example Update #1").stream().sorted().toList());
        assertEquals(2, events.byType(NotificationDelivered.class).size());
    }

    @Test
    void dedupIsEvaluatedOncePerMessageBeforeAnySend() {
        RecordingTransport transport = new RecordingTransport();
        NotificationFanOut fanOut = fanOut(transport, FanOutSettings.defaults());
        List<Subscriber> subscribers = subscribers(3);

        DeliveryReport first = fanOut.deliver("example", "same text", subscribers);
        DeliveryReport second = fanOut.deliver("example", "same text", subscribers);

        assertEquals(3, first.sent());
        assertTrue(second.duplicate());
        assertEquals(0, second.sent());
        assertEquals(2, dedup.checkCount());
        assertEquals(3, transport.sent().size());
    }

    @Test
    void identicalTextForAnotherSiteIsNotADuplicate() {
        RecordingTransport transport = new RecordingTransport();
        NotificationFanOut fanOut = fanOut(transport, FanOutSettings.defaults());

        fanOut.deliver("siteA", "X", subscribers(1));
        DeliveryReport other = fanOut.deliver("siteB", "X", subscribers(1));

        assertFalse(other.duplicate());
        assertEquals(1, other.sent());
    }

    @Test
    void noReachableSubscriberLeavesNoDedupRecord() {
        NotificationFanOut fanOut = fanOut(new RecordingTransport(), FanOutSettings.defaults());

        DeliveryReport report = fanOut.deliver("example", "text", List.of(new Subscriber("u1", false, null)));

        assertEquals(1, report.skippedWithoutSession());
        assertEquals(0, dedup.checkCount());
        assertFalse(dedup.isDuplicate("example", "text"));
    }

    @Test
    void oneFailingSubscriberDoesNotAffectTheOthers() {
        RecordingTransport transport = new RecordingTransport();
        transport.failFor("s1");
        transport.throwFor("s3");
        NotificationFanOut fanOut = fanOut(transport, new FanOutSettings(2, Duration.ofSeconds(5)));

        DeliveryReport report = fanOut.deliver("example", "update", subscribers(5));

        assertEquals(3, report.sent());
        assertEquals(2, report.failed());
        assertEquals(List.of("s0", "s2", "s4"), transport.sessionsFor("update").stream().sorted().toList());
        assertEquals(2, events.alerts(AlertRaised.DELIVERY).size());
        assertTrue(dedup.isDuplicate("example", "update"), "the dedup record stays committed after failures");
    }

    @Test
    void hangingSendTimesOutAsAFailure() {
        RecordingTransport transport = new RecordingTransport();
        transport.hangFor("s0");
        NotificationFanOut fanOut = fanOut(transport, new FanOutSettings(10, Duration.ofMillis(100)));
        try {
            DeliveryReport report = fanOut.deliver("example", "update", subscribers(3));

            assertEquals(2, report.sent());
            assertEquals(1, report.failed());
            assertTrue(events.alerts(AlertRaised.DELIVERY).get(0).message().contains("timed out"));
        } finally {
            transport.releaseAll();
        }
    }

    @Test
    void batchesBoundConcurrentSends() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        AtomicInteger delivered = new AtomicInteger();
        Transport slow = (session, text) -> {
            int now = inFlight.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
            }
            delivered.incrementAndGet();
            return true;
        };
        NotificationFanOut fanOut = fanOut(slow, new FanOutSettings(3, Duration.ofSeconds(5)));

        DeliveryReport report = fanOut.deliver("example", "update", subscribers(10));

        assertEquals(10, report.sent());
        assertEquals(10, delivered.get());
        assertTrue(peak.get() <= 3, "peak concurrency was " + peak.get());
    }

    private NotificationFanOut fanOut(Transport transport, FanOutSettings settings) {
        return new NotificationFanOut(dedup, transport, bus, clock, settings, pool);
    }

    private static List<Subscriber> subscribers(int count) {
        List<Subscriber> subscribers = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            subscribers.add(new Subscriber("u" + i, false, "s" + i));
        }
        return subscribers;
    }
}
