package com.sitewatch.service.registry;

import com.sitewatch.sites.api.Site;

import java.util.Objects;

/**
 * A validated site as registered: the capability values are read once at registration and never
 * re-read, so a plugin cannot change its id or schedule afterwards.
 */
public record SiteDescriptor(
        String id,
        String displayName,
        String description,
        String schedule,
        String source,
        Site site
) {
    public SiteDescriptor {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(displayName, "displayName is required");
        Objects.requireNonNull(description, "description is required");
        Objects.requireNonNull(schedule, "schedule is required");
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(site, "site is required");
    }
}
