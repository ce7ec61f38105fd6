package com.sitewatch.sites.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base for sites that compare a freshly fetched snapshot with the one cached by the previous
 * check. The flow is load cache, fetch, diff, format, save. A failed fetch leaves the cache
 * untouched so the next check diffs against the last good snapshot.
 *
 * @param <S> snapshot type, converted to and from JSON for the cache
 */
public abstract class DiffingSite<S> implements Site {
    private static final Logger LOGGER = Logger.getLogger(DiffingSite.class.getName());

    @Override
    public CompletableFuture<CheckResult> checkUpdates(SiteContext ctx) {
        Optional<S> previous;
        try {
            previous = ctx.cacheStore().load(id()).map(this::fromCache);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Ignoring unreadable cache for site " + id(), e);
            previous = Optional.empty();
        }
        Optional<S> cached = previous;
        CompletableFuture<S> latest;
        try {
            latest = fetch(ctx);
        } catch (RuntimeException e) {
            latest = CompletableFuture.failedFuture(e);
        }
        return latest.thenApply(snapshot -> {
            List<String> messages = cached.isEmpty()
                    ? firstRunMessages(snapshot)
                    : newMessages(cached.get(), snapshot);
            if (!ctx.cacheStore().save(id(), toCache(snapshot))) {
                LOGGER.warning("Cache for site " + id() + " was not persisted; next check may repeat updates");
            }
            return CheckResult.success(messages);
        }).exceptionally(CheckResult::failure);
    }

    /** Fetches the current upstream state. */
    protected abstract CompletableFuture<S> fetch(SiteContext ctx);

    /** Messages for the very first check, when there is nothing to diff against. */
    protected abstract List<String> firstRunMessages(S latest);

    /** Messages for what {@code latest} has that {@code previous} did not. */
    protected abstract List<String> newMessages(S previous, S latest);

    protected abstract JsonNode toCache(S snapshot);

    protected abstract S fromCache(JsonNode cached);
}
