package com.sitewatch.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitewatch.core.util.HashingUtils;
import com.sitewatch.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Dedup records kept as {@code {siteId: {md5: epochSeconds}}} in a single JSON document.
 * Expired records are dropped on load and lazily on every read or write for the touched site.
 */
public class JsonFileDedupStore implements DedupStore {
    private static final Logger LOGGER = Logger.getLogger(JsonFileDedupStore.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final Clock clock;
    private final double retentionSeconds;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Map<String, Double>> sent = new LinkedHashMap<>();

    public JsonFileDedupStore(Path file, Clock clock) {
        this(file, clock, RETENTION);
    }

    public JsonFileDedupStore(Path file, Clock clock, Duration retention) {
        this.file = file;
        this.clock = clock;
        this.retentionSeconds = retention.toMillis() / 1000.0;
        loadIfPresent();
    }

    @Override
    public boolean isDuplicate(String siteId, String message) {
        String hash = HashingUtils.md5(message);
        lock.lock();
        try {
            return live(siteId).containsKey(hash);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean record(String siteId, String message) {
        String hash = HashingUtils.md5(message);
        lock.lock();
        try {
            Map<String, Double> records = live(siteId);
            records.put(hash, nowSeconds());
            sent.put(siteId, records);
            return persist();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean checkAndRecord(String siteId, String message) {
        String hash = HashingUtils.md5(message);
        lock.lock();
        try {
            Map<String, Double> records = live(siteId);
            if (records.containsKey(hash)) {
                return true;
            }
            records.put(hash, nowSeconds());
            sent.put(siteId, records);
            persist();
            return false;
        } finally {
            lock.unlock();
        }
    }

    /** Number of unexpired records for a site. */
    public int size(String siteId) {
        lock.lock();
        try {
            return live(siteId).size();
        } finally {
            lock.unlock();
        }
    }

    private Map<String, Double> live(String siteId) {
        Map<String, Double> records = sent.get(siteId);
        if (records == null) {
            return new LinkedHashMap<>();
        }
        evictExpired(records, nowSeconds());
        if (records.isEmpty()) {
            sent.remove(siteId);
        }
        return records;
    }

    private void evictExpired(Map<String, Double> records, double now) {
        double cutoff = now - retentionSeconds;
        records.values().removeIf(sentAt -> sentAt <= cutoff);
    }

    private double nowSeconds() {
        return clock.millis() / 1000.0;
    }

    private void loadIfPresent() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return;
            }
            JsonNode root;
            try (InputStream in = Files.newInputStream(file)) {
                root = MAPPER.readTree(in);
            }
            if (root == null || !root.isObject()) {
                throw new IOException("Expected a JSON object");
            }
            double now = nowSeconds();
            int loaded = 0;
            boolean evicted = false;
            Iterator<Map.Entry<String, JsonNode>> sites = root.fields();
            while (sites.hasNext()) {
                Map.Entry<String, JsonNode> site = sites.next();
                if (!site.getValue().isObject()) {
                    evicted = true;
                    continue;
                }
                Map<String, Double> records = new LinkedHashMap<>();
                site.getValue().fields().forEachRemaining(entry -> {
                    if (entry.getValue().isNumber()) {
                        records.put(entry.getKey(), entry.getValue().asDouble());
                    }
                });
                int before = records.size();
                evictExpired(records, now);
                evicted |= records.size() != before || records.isEmpty();
                if (!records.isEmpty()) {
                    sent.put(site.getKey(), records);
                    loaded += records.size();
                }
            }
            LOGGER.info("Loaded " + loaded + " recent sent-message records across " + sent.size() + " site(s)");
            if (evicted) {
                persist();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading sent-message records from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private boolean persist() {
        try {
            AtomicFiles.write(file, out -> JsonUtils.prettyWriter().writeValue(out, sent));
            return true;
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed writing sent-message records to " + file, e);
            return false;
        }
    }
}
