package com.sitewatch.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitewatch.core.model.SiteIds;
import com.sitewatch.core.util.JsonUtils;
import com.sitewatch.sites.api.CacheStore;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One pretty-printed JSON file per site under a cache directory. Snapshots are opaque here:
 * no TTL, no eviction, no interpretation.
 */
public class JsonFileCacheStore implements CacheStore {
    private static final Logger LOGGER = Logger.getLogger(JsonFileCacheStore.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path directory;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonFileCacheStore(Path directory) {
        this.directory = directory;
    }

    @Override
    public Optional<JsonNode> load(String siteId) {
        Path file = fileFor(siteId);
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            try (InputStream in = Files.newInputStream(file)) {
                JsonNode node = MAPPER.readTree(in);
                return node == null || node.isMissingNode() ? Optional.empty() : Optional.of(node);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed loading cache for site " + siteId + " from " + file + "; treating as first run", e);
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean save(String siteId, JsonNode snapshot) {
        Path file = fileFor(siteId);
        lock.lock();
        try {
            AtomicFiles.write(file, out -> JsonUtils.prettyWriter().writeValue(out, snapshot));
            return true;
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed writing cache for site " + siteId + " to " + file, e);
            return false;
        } finally {
            lock.unlock();
        }
    }

    Path fileFor(String siteId) {
        return directory.resolve(SiteIds.requireValid(siteId) + ".json");
    }
}
