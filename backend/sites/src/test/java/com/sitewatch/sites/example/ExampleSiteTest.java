package com.sitewatch.sites.example;

import com.sitewatch.sites.api.CheckResult;
import com.sitewatch.sites.api.SiteContext;
import com.sitewatch.sites.support.InMemoryCacheStore;
import com.sitewatch.sites.support.SiteContexts;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExampleSiteTest {
    @Test
    void firstCheckWithoutCachePublishesUpdateOne() {
        InMemoryCacheStore cache = new InMemoryCacheStore();
        SiteContext ctx = SiteContexts.context(cache, Duration.ofSeconds(1));

        CheckResult result = new ExampleSite().checkUpdates(ctx).join();

        assertTrue(result.success());
        assertEquals(1, result.messages().size());
        assertTrue(result.messages().get(0).contains("Example Update #1"));
        assertEquals(1, cache.peek(ExampleSite.ID).orElseThrow().get("update_count").asLong());
    }

    @Test
    void laterChecksContinueFromTheCachedCounter() {
        InMemoryCacheStore cache = new InMemoryCacheStore();
        SiteContext ctx = SiteContexts.context(cache, Duration.ofSeconds(1));
        ExampleSite site = new ExampleSite(2, "interval:10");

        List<String> first = site.checkUpdates(ctx).join().messages();
        List<String> second = site.checkUpdates(ctx).join().messages();

        assertTrue(first.get(0).contains("Example Update #1"));
        assertTrue(first.get(1).contains("Example Update #2"));
        assertTrue(second.get(0).contains("Example Update #3"));
        assertTrue(second.get(1).contains("Example Update #4"));
        assertEquals(4, cache.peek(ExampleSite.ID).orElseThrow().get("update_count").asLong());
    }

    @Test
    void unpersistableCacheFailsTheCheck() {
        InMemoryCacheStore cache = new InMemoryCacheStore();
        cache.failWrites(true);

        CheckResult result = new ExampleSite().checkUpdates(SiteContexts.context(cache, Duration.ofSeconds(1))).join();

        assertFalse(result.success());
        assertTrue(result.messages().isEmpty());
    }

    @Test
    void describesItselfForRegistration() {
        ExampleSite site = new ExampleSite();

        assertEquals("example", site.id());
        assertEquals("Example Site", site.displayName());
        assertEquals("interval:10", site.schedule());
        assertFalse(site.description().isBlank());
        assertThrows(IllegalArgumentException.class, () -> new ExampleSite(0, "interval:10"));
    }
}
