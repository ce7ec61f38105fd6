package com.sitewatch.sites.example;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sitewatch.core.util.JsonUtils;
import com.sitewatch.sites.api.CheckResult;
import com.sitewatch.sites.api.Site;
import com.sitewatch.sites.api.SiteContext;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Demo site that publishes a new numbered update on every check. Its "upstream" is the update
 * counter kept in its own cache entry, which makes it handy for exercising the pipeline end to end.
 */
public class ExampleSite implements Site {
    public static final String ID = "example";
    private static final Logger LOGGER = Logger.getLogger(ExampleSite.class.getName());

    private final int updatesPerCheck;
    private final String schedule;

    public ExampleSite() {
        this(1, "interval:10");
    }

    public ExampleSite(int updatesPerCheck, String schedule) {
        if (updatesPerCheck < 1) {
            throw new IllegalArgumentException("updatesPerCheck must be at least 1");
        }
        this.updatesPerCheck = updatesPerCheck;
        this.schedule = schedule;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String displayName() {
        return "Example Site";
    }

    @Override
    public String description() {
        return "Example site that publishes a numbered test update on every check";
    }

    @Override
    public String schedule() {
        return schedule;
    }

    @Override
    public CompletableFuture<CheckResult> checkUpdates(SiteContext ctx) {
        long lastUpdate = ctx.cacheStore().load(ID)
                .map(ExampleSite::updateCount)
                .orElse(0L);

        List<String> messages = new ArrayList<>();
        for (int i = 1; i <= updatesPerCheck; i++) {
            messages.add("[Example Site]\nExample Update #" + (lastUpdate + i) + "\nThis is example content " + i);
        }
        long newest = lastUpdate + updatesPerCheck;

        ObjectNode snapshot = JsonUtils.objectMapper().createObjectNode();
        snapshot.put("timestamp", ctx.clock().instant().getEpochSecond());
        snapshot.put("update_count", newest);
        snapshot.put("title", "Example Update #" + newest);
        if (!ctx.cacheStore().save(ID, snapshot)) {
            return CompletableFuture.completedFuture(CheckResult.failure("Could not persist example cache"));
        }

        LOGGER.fine(() -> "Example site produced " + messages.size() + " update(s), now at #" + newest);
        return CompletableFuture.completedFuture(CheckResult.success(messages));
    }

    private static long updateCount(JsonNode cached) {
        return cached.path("update_count").asLong(0);
    }
}
