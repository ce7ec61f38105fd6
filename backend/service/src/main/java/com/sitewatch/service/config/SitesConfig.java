package com.sitewatch.service.config;

import com.sitewatch.sites.config.RssSiteConfig;

import java.util.List;

/** Contents of {@code config/sites.json}: sites defined by configuration rather than code. */
public record SitesConfig(List<RssSiteConfig> rss) {
    public SitesConfig {
        rss = rss == null ? List.of() : List.copyOf(rss);
    }

    public static SitesConfig empty() {
        return new SitesConfig(List.of());
    }
}
