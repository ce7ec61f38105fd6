package com.sitewatch.sites.config;

import java.util.Objects;

public record RssSiteConfig(
        String id,
        String displayName,
        String description,
        String schedule,
        String url,
        int maxMessagesPerCheck
) {
    public static final int DEFAULT_MAX_MESSAGES = 5;

    public RssSiteConfig {
        Objects.requireNonNull(url, "url is required");
        description = description == null ? "RSS feed " + url : description;
        maxMessagesPerCheck = maxMessagesPerCheck <= 0 ? DEFAULT_MAX_MESSAGES : maxMessagesPerCheck;
    }
}
