package com.sitewatch.sites.api;

import java.util.concurrent.CompletableFuture;

/**
 * A pluggable source of content. Implementations own fetching, diffing against their cached
 * snapshot, and formatting; the service only schedules them and fans out what they return.
 */
public interface Site {
    /** Stable internal id; also names the site's cache entry. */
    String id();

    /** Name users type to subscribe. */
    String displayName();

    String description();

    /** {@code interval:<seconds>} or a five-field cron expression. */
    String schedule();

    /**
     * Checks the upstream once. Messages come back in delivery order; an empty list means no
     * update. Failures should be reported as {@link CheckResult#failure(String)}, though a thrown
     * exception or an exceptionally completed future is treated the same way.
     */
    CompletableFuture<CheckResult> checkUpdates(SiteContext ctx);
}
