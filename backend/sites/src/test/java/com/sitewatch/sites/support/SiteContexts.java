package com.sitewatch.sites.support;

import com.sitewatch.sites.api.CacheStore;
import com.sitewatch.sites.api.SiteContext;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

public final class SiteContexts {
    private SiteContexts() {
    }

    public static SiteContext context(CacheStore cacheStore, Duration requestTimeout) {
        return new SiteContext(
                cacheStore,
                HttpClient.newBuilder().connectTimeout(requestTimeout).build(),
                Clock.fixed(Instant.parse("2026-02-09T20:00:00Z"), ZoneOffset.UTC),
                requestTimeout,
                Map.of()
        );
    }
}
