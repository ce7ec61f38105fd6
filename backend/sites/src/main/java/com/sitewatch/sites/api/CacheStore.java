package com.sitewatch.sites.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Per-site snapshot storage. Contents are opaque to everything except the owning site.
 */
public interface CacheStore {
    /** Empty on the first run, or when the stored snapshot can no longer be read. */
    Optional<JsonNode> load(String siteId);

    /** @return false when the snapshot could not be persisted */
    boolean save(String siteId, JsonNode snapshot);
}
