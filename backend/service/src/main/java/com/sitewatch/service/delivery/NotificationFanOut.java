package com.sitewatch.service.delivery;

import com.sitewatch.core.bus.EventBus;
import com.sitewatch.core.events.AlertRaised;
import com.sitewatch.core.events.NotificationDelivered;
import com.sitewatch.service.store.DedupStore;
import com.sitewatch.service.store.Subscriber;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends one site message to its subscribers. The message is checked against the dedup store
 * once, before any send; a duplicate goes to nobody. Subscribers are sent to in batches, each
 * batch fully dispatched before the next starts, and one subscriber's failure never affects
 * the others.
 */
public class NotificationFanOut {
    private static final Logger LOGGER = Logger.getLogger(NotificationFanOut.class.getName());

    private final DedupStore dedupStore;
    private final Transport transport;
    private final EventBus eventBus;
    private final Clock clock;
    private final FanOutSettings settings;
    private final ExecutorService deliveryExecutor;

    public NotificationFanOut(
            DedupStore dedupStore,
            Transport transport,
            EventBus eventBus,
            Clock clock,
            FanOutSettings settings,
            ExecutorService deliveryExecutor
    ) {
        this.dedupStore = Objects.requireNonNull(dedupStore, "dedupStore is required");
        this.transport = Objects.requireNonNull(transport, "transport is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.deliveryExecutor = Objects.requireNonNull(deliveryExecutor, "deliveryExecutor is required");
    }

    /** Blocks until every batch has been dispatched and each send has finished or timed out. */
    public DeliveryReport deliver(String siteId, String message, List<Subscriber> subscribers) {
        List<Subscriber> reachable = new ArrayList<>();
        int skipped = 0;
        for (Subscriber subscriber : subscribers) {
            if (subscriber.hasSession()) {
                reachable.add(subscriber);
            } else {
                skipped++;
                LOGGER.info("Subscriber " + subscriber.id() + " of site " + siteId + " has no session; skipping until they subscribe again");
            }
        }
        if (reachable.isEmpty()) {
            return new DeliveryReport(false, 0, 0, skipped);
        }
        if (dedupStore.checkAndRecord(siteId, message)) {
            LOGGER.fine("Suppressing duplicate message for site " + siteId);
            return DeliveryReport.duplicate(skipped);
        }

        AtomicInteger sent = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();
        for (int start = 0; start < reachable.size(); start += settings.batchSize()) {
            List<Subscriber> batch = reachable.subList(start, Math.min(start + settings.batchSize(), reachable.size()));
            List<CompletableFuture<Void>> sends = new ArrayList<>(batch.size());
            for (Subscriber subscriber : batch) {
                sends.add(sendOne(siteId, message, subscriber)
                        .thenAccept(delivered -> (delivered ? sent : failed).incrementAndGet()));
            }
            CompletableFuture.allOf(sends.toArray(CompletableFuture[]::new)).join();
        }
        return new DeliveryReport(false, sent.get(), failed.get(), skipped);
    }

    private CompletableFuture<Boolean> sendOne(String siteId, String message, Subscriber subscriber) {
        CompletableFuture<Boolean> send;
        try {
            send = CompletableFuture.supplyAsync(() -> transport.send(subscriber.sessionContext(), message), deliveryExecutor);
        } catch (RejectedExecutionException e) {
            send = CompletableFuture.failedFuture(e);
        }
        return send
                .orTimeout(settings.sendTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((delivered, error) -> {
                    if (error == null && Boolean.TRUE.equals(delivered)) {
                        eventBus.publish(new NotificationDelivered(clock.instant(), siteId, subscriber.id(), subscriber.group()));
                        return true;
                    }
                    reportFailure(siteId, subscriber, error);
                    return false;
                });
    }

    private void reportFailure(String siteId, Subscriber subscriber, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        String reason;
        if (cause == null) {
            reason = "transport reported failure";
        } else if (cause instanceof TimeoutException) {
            reason = "timed out after " + settings.sendTimeout();
        } else {
            reason = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        }
        String text = "Delivery of site " + siteId + " to " + subscriber.id() + " failed: " + reason;
        LOGGER.log(Level.WARNING, text, cause);
        eventBus.publish(new AlertRaised(
                clock.instant(),
                AlertRaised.DELIVERY,
                text,
                Map.of("site", siteId, "subscriber", subscriber.id())
        ));
    }
}
