package com.sitewatch.sites.api;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

public record SiteContext(
        CacheStore cacheStore,
        HttpClient httpClient,
        Clock clock,
        Duration requestTimeout,
        Map<String, Object> config
) {
    public SiteContext {
        Objects.requireNonNull(cacheStore, "cacheStore is required");
        Objects.requireNonNull(httpClient, "httpClient is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(requestTimeout, "requestTimeout is required");
        config = config == null ? Map.of() : Map.copyOf(config);
    }

    public <T> T requiredConfig(String key, Class<T> type) {
        Object value = config.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing required config key: " + key);
        }
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Config key '" + key + "' must be " + type.getSimpleName());
        }
        return type.cast(value);
    }
}
