package com.sitewatch.service.store;

import java.time.Duration;

/**
 * Remembers which message texts were already sent for a site. Records are namespaced per site:
 * identical text for two sites is not a duplicate. A record older than {@link #RETENTION} counts
 * as absent whether or not it has been evicted yet.
 */
public interface DedupStore {
    Duration RETENTION = Duration.ofDays(7);

    boolean isDuplicate(String siteId, String message);

    /** @return false when the record could not be persisted; it is still kept in memory */
    boolean record(String siteId, String message);

    /**
     * Checks and records as one atomic step.
     *
     * @return true if the message was already recorded for the site, in which case nothing changes
     */
    boolean checkAndRecord(String siteId, String message);
}
