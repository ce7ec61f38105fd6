package com.sitewatch.service.subscription;

import com.sitewatch.core.bus.EventBus;
import com.sitewatch.core.events.AlertRaised;
import com.sitewatch.core.model.SiteIds;
import com.sitewatch.service.registry.SiteDescriptor;
import com.sitewatch.service.registry.SiteRegistry;
import com.sitewatch.service.store.SubscriptionStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Subscription operations as a host command layer needs them: site names are resolved through
 * the registry and every outcome is a {@link SubscriptionResult} rather than a bare boolean.
 */
public class SubscriptionService {
    private static final Logger LOGGER = Logger.getLogger(SubscriptionService.class.getName());

    private final SubscriptionStore store;
    private final SiteRegistry registry;
    private final EventBus eventBus;
    private final Clock clock;

    public SubscriptionService(SubscriptionStore store, SiteRegistry registry, EventBus eventBus, Clock clock) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /** Accepts a display name, a site id, or the all-sites display name. */
    public SubscriptionResult subscribe(String subscriberId, boolean group, String siteName, String sessionContext) {
        String siteId = registry.resolveSiteId(siteName);
        if (siteId == null || (!SiteIds.ALL.equals(siteId) && !registry.isRegistered(siteId))) {
            return SubscriptionResult.UNKNOWN_SITE;
        }
        if (!store.subscribe(subscriberId, group, siteId, sessionContext)) {
            return storageFailure("subscribe", subscriberId, siteId);
        }
        LOGGER.info((group ? "Group " : "User ") + subscriberId + " subscribed to " + siteId);
        return SubscriptionResult.SUBSCRIBED;
    }

    public SubscriptionResult subscribeAll(String subscriberId, boolean group, String sessionContext) {
        return subscribe(subscriberId, group, registry.allSitesDisplayName(), sessionContext);
    }

    /**
     * Unsubscribing works for ids whose site has since been removed, so stale entries can still
     * be cleaned up.
     */
    public SubscriptionResult unsubscribe(String subscriberId, boolean group, String siteName) {
        String siteId = registry.resolveSiteId(siteName);
        if (siteId == null || !store.getSubscriptions(subscriberId, group).contains(siteId)) {
            return SubscriptionResult.NOT_SUBSCRIBED;
        }
        if (!store.unsubscribe(subscriberId, group, siteId)) {
            return storageFailure("unsubscribe", subscriberId, siteId);
        }
        LOGGER.info((group ? "Group " : "User ") + subscriberId + " unsubscribed from " + siteId);
        return SubscriptionResult.UNSUBSCRIBED;
    }

    public SubscriptionResult unsubscribeAll(String subscriberId, boolean group) {
        return unsubscribe(subscriberId, group, registry.allSitesDisplayName());
    }

    public SubscriptionListing listing(String subscriberId, boolean group) {
        Set<String> held = store.getSubscriptions(subscriberId, group);
        List<SiteSummary> subscribed = new ArrayList<>();
        List<SiteSummary> available = new ArrayList<>();
        for (SiteDescriptor site : registry.all()) {
            (held.contains(site.id()) ? subscribed : available).add(SiteSummary.of(site));
        }
        held.stream()
                .filter(siteId -> !SiteIds.ALL.equals(siteId) && !registry.isRegistered(siteId))
                .sorted()
                .forEach(siteId -> subscribed.add(SiteSummary.orphan(siteId)));
        return new SubscriptionListing(held.contains(SiteIds.ALL), subscribed, available);
    }

    private SubscriptionResult storageFailure(String operation, String subscriberId, String siteId) {
        String message = "Could not persist " + operation + " of " + subscriberId + " for site " + siteId;
        LOGGER.warning(message);
        eventBus.publish(new AlertRaised(
                clock.instant(),
                AlertRaised.STORAGE,
                message,
                Map.of("site", siteId, "subscriber", subscriberId)
        ));
        return SubscriptionResult.STORAGE_FAILURE;
    }
}
