package com.sitewatch.service.store;

import java.util.List;
import java.util.Set;

/**
 * Who wants notifications for which site. Every operation is qualified by
 * {@code (subscriberId, group)}; the same id as a user and as a group are two subscribers.
 * The site id {@link com.sitewatch.core.model.SiteIds#ALL} subscribes to every site.
 */
public interface SubscriptionStore {
    /**
     * Adds the site to the subscriber's set and captures the session context when one is given.
     *
     * @return false only when the change could not be persisted
     */
    boolean subscribe(String subscriberId, boolean group, String siteId, String sessionContext);

    /**
     * @return false when the subscriber did not hold the site or the change could not be persisted
     */
    boolean unsubscribe(String subscriberId, boolean group, String siteId);

    Set<String> getSubscriptions(String subscriberId, boolean group);

    /**
     * Subscribers holding the site or the wildcard, each listed once, in subscription order.
     * Empty for a site that is not registered.
     */
    List<Subscriber> getSubscribers(String siteId);

    default boolean hasSubscribers(String siteId) {
        return !getSubscribers(siteId).isEmpty();
    }
}
