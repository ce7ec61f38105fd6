package com.sitewatch.sites.rss;

import java.time.Instant;

/**
 * One entry of an RSS or Atom feed. {@code key} identifies the entry across fetches.
 */
public record FeedItem(String key, String title, String link, Instant publishedAt) {
}
