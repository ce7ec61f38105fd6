package com.sitewatch.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitewatch.core.model.SiteIds;
import com.sitewatch.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

public class JsonFileSubscriptionStore implements SubscriptionStore {
    private static final Logger LOGGER = Logger.getLogger(JsonFileSubscriptionStore.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final Predicate<String> isRegistered;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Key, Entry> entries = new LinkedHashMap<>();

    public JsonFileSubscriptionStore(Path file, Predicate<String> isRegistered) {
        this.file = file;
        this.isRegistered = Objects.requireNonNull(isRegistered, "isRegistered is required");
        loadIfPresent();
    }

    @Override
    public boolean subscribe(String subscriberId, boolean group, String siteId, String sessionContext) {
        Key key = new Key(requireText(subscriberId, "subscriberId"), group);
        requireText(siteId, "siteId");
        lock.lock();
        try {
            Entry entry = entries.computeIfAbsent(key, ignored -> new Entry());
            entry.sites.add(siteId);
            if (sessionContext != null) {
                entry.sessionContext = sessionContext;
            }
            return persist();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean unsubscribe(String subscriberId, boolean group, String siteId) {
        Key key = new Key(requireText(subscriberId, "subscriberId"), group);
        requireText(siteId, "siteId");
        lock.lock();
        try {
            Entry entry = entries.get(key);
            if (entry == null || !entry.sites.remove(siteId)) {
                return false;
            }
            if (entry.sites.isEmpty()) {
                entries.remove(key);
            }
            return persist();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Set<String> getSubscriptions(String subscriberId, boolean group) {
        lock.lock();
        try {
            Entry entry = entries.get(new Key(subscriberId, group));
            return entry == null ? Set.of() : Set.copyOf(entry.sites);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Subscriber> getSubscribers(String siteId) {
        if (siteId == null || SiteIds.ALL.equals(siteId) || !isRegistered.test(siteId)) {
            return List.of();
        }
        lock.lock();
        try {
            List<Subscriber> subscribers = new ArrayList<>();
            for (Map.Entry<Key, Entry> item : entries.entrySet()) {
                Set<String> sites = item.getValue().sites;
                if (sites.contains(siteId) || sites.contains(SiteIds.ALL)) {
                    Key key = item.getKey();
                    subscribers.add(new Subscriber(key.subscriberId(), key.group(), item.getValue().sessionContext));
                }
            }
            return List.copyOf(subscribers);
        } finally {
            lock.unlock();
        }
    }

    private void loadIfPresent() {
        if (!Files.exists(file)) {
            return;
        }
        try (InputStream in = Files.newInputStream(file)) {
            SubscriptionDocument document = MAPPER.readValue(in, SubscriptionDocument.class);
            if (document == null || document.subscriptions() == null) {
                return;
            }
            for (StoredSubscription stored : document.subscriptions()) {
                if (stored.subscriberId() == null || stored.sites() == null || stored.sites().isEmpty()) {
                    continue;
                }
                Entry entry = entries.computeIfAbsent(new Key(stored.subscriberId(), stored.group()), ignored -> new Entry());
                entry.sites.addAll(stored.sites());
                if (stored.sessionContext() != null) {
                    entry.sessionContext = stored.sessionContext();
                }
            }
            LOGGER.info("Loaded " + entries.size() + " subscription(s) from " + file);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading subscriptions from " + file, e);
        }
    }

    private boolean persist() {
        List<StoredSubscription> stored = new ArrayList<>();
        for (Map.Entry<Key, Entry> item : entries.entrySet()) {
            stored.add(new StoredSubscription(
                    item.getKey().subscriberId(),
                    item.getKey().group(),
                    List.copyOf(item.getValue().sites),
                    item.getValue().sessionContext
            ));
        }
        try {
            AtomicFiles.write(file, out -> JsonUtils.prettyWriter().writeValue(out, new SubscriptionDocument(stored)));
            return true;
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed writing subscriptions to " + file, e);
            return false;
        }
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    private record Key(String subscriberId, boolean group) {
    }

    private static final class Entry {
        private final Set<String> sites = new LinkedHashSet<>();
        private String sessionContext;
    }

    record SubscriptionDocument(List<StoredSubscription> subscriptions) {
    }

    record StoredSubscription(String subscriberId, boolean group, List<String> sites, String sessionContext) {
    }
}
