package com.sitewatch.service.status;

import com.sitewatch.core.bus.EventBus;
import com.sitewatch.core.events.AlertRaised;
import com.sitewatch.core.events.CheckCompleted;
import com.sitewatch.core.events.CheckSkipped;
import com.sitewatch.core.events.CheckStarted;
import com.sitewatch.core.events.NotificationDelivered;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Per-site view of recent scheduler activity, built only from bus events.
 */
public final class SiteStatusTracker {
    private final ConcurrentHashMap<String, SiteStatus> statuses = new ConcurrentHashMap<>();

    public SiteStatusTracker(EventBus eventBus) {
        eventBus.subscribe(CheckStarted.class, this::onCheckStarted);
        eventBus.subscribe(CheckCompleted.class, this::onCheckCompleted);
        eventBus.subscribe(CheckSkipped.class, this::onCheckSkipped);
        eventBus.subscribe(NotificationDelivered.class, this::onDelivered);
        eventBus.subscribe(AlertRaised.class, this::onAlertRaised);
    }

    /** Site id to a map of status fields, sorted by site id. */
    public Map<String, Map<String, Object>> snapshot() {
        Map<String, Map<String, Object>> sites = new TreeMap<>();
        statuses.forEach((siteId, status) -> sites.put(siteId, status.toMap()));
        return Collections.unmodifiableMap(sites);
    }

    public long deliveredTotal(String siteId) {
        SiteStatus status = statuses.get(siteId);
        return status == null ? 0 : status.deliveredTotal();
    }

    private void onCheckStarted(CheckStarted event) {
        update(event.siteId(), status -> status.withLastRunAt(event.timestamp()));
    }

    private void onCheckCompleted(CheckCompleted event) {
        update(event.siteId(), status -> status.withCompletion(event.durationMillis(), event.success()));
    }

    private void onCheckSkipped(CheckSkipped event) {
        if (event.reason() == CheckSkipped.Reason.IN_FLIGHT) {
            update(event.siteId(), SiteStatus::withDroppedTrigger);
        }
    }

    private void onDelivered(NotificationDelivered event) {
        update(event.siteId(), SiteStatus::withDelivery);
    }

    private void onAlertRaised(AlertRaised event) {
        if (!AlertRaised.CHECK.equals(event.category()) || event.details() == null) {
            return;
        }
        Object site = event.details().get("site");
        if (!(site instanceof String siteId) || siteId.isBlank()) {
            return;
        }
        update(siteId, status -> status.withLastErrorMessage(event.message()));
    }

    private void update(String siteId, UnaryOperator<SiteStatus> change) {
        statuses.compute(siteId, (id, current) -> change.apply(current == null ? SiteStatus.empty() : current));
    }

    private record SiteStatus(
            Instant lastRunAt,
            Long lastDurationMillis,
            Boolean lastSuccess,
            String lastErrorMessage,
            long deliveredTotal,
            long droppedTriggers
    ) {
        private static SiteStatus empty() {
            return new SiteStatus(null, null, null, null, 0, 0);
        }

        private SiteStatus withLastRunAt(Instant runAt) {
            return new SiteStatus(runAt, lastDurationMillis, lastSuccess, lastErrorMessage, deliveredTotal, droppedTriggers);
        }

        private SiteStatus withCompletion(long durationMillis, boolean success) {
            return new SiteStatus(lastRunAt, durationMillis, success, success ? null : lastErrorMessage, deliveredTotal, droppedTriggers);
        }

        private SiteStatus withLastErrorMessage(String message) {
            return new SiteStatus(lastRunAt, lastDurationMillis, lastSuccess, message, deliveredTotal, droppedTriggers);
        }

        private SiteStatus withDelivery() {
            return new SiteStatus(lastRunAt, lastDurationMillis, lastSuccess, lastErrorMessage, deliveredTotal + 1, droppedTriggers);
        }

        private SiteStatus withDroppedTrigger() {
            return new SiteStatus(lastRunAt, lastDurationMillis, lastSuccess, lastErrorMessage, deliveredTotal, droppedTriggers + 1);
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("lastRunAt", lastRunAt == null ? null : lastRunAt.toString());
            map.put("lastDurationMillis", lastDurationMillis);
            map.put("lastSuccess", lastSuccess);
            map.put("lastErrorMessage", lastErrorMessage);
            map.put("deliveredTotal", deliveredTotal);
            map.put("droppedTriggers", droppedTriggers);
            return Collections.unmodifiableMap(map);
        }
    }
}
