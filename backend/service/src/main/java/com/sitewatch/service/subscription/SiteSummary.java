package com.sitewatch.service.subscription;

import com.sitewatch.service.registry.SiteDescriptor;

public record SiteSummary(String id, String displayName, String description) {
    static SiteSummary of(SiteDescriptor site) {
        return new SiteSummary(site.id(), site.displayName(), site.description());
    }

    /** A subscribed id whose site is no longer registered. */
    static SiteSummary orphan(String siteId) {
        return new SiteSummary(siteId, siteId, "");
    }
}
