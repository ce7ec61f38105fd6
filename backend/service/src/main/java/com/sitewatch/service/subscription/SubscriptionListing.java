package com.sitewatch.service.subscription;

import java.util.List;

/**
 * @param allSites   whether the subscriber holds the all-sites wildcard
 * @param subscribed explicitly subscribed sites
 * @param available  registered sites not explicitly subscribed
 */
public record SubscriptionListing(boolean allSites, List<SiteSummary> subscribed, List<SiteSummary> available) {
    public SubscriptionListing {
        subscribed = List.copyOf(subscribed);
        available = List.copyOf(available);
    }
}
