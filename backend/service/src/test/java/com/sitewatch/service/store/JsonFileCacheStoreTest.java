package com.sitewatch.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sitewatch.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileCacheStoreTest {
    @Test
    void savedSnapshotLoadsBackStructurallyEqual() throws Exception {
        Path dir = Files.createTempDirectory("cache-store-roundtrip-");
        JsonFileCacheStore store = new JsonFileCacheStore(dir.resolve("cache"));
        ObjectNode snapshot = JsonUtils.objectMapper().createObjectNode();
        snapshot.put("update_count", 3);
        snapshot.putArray("items").add("a").add("b");

        assertTrue(store.save("example", snapshot));

        JsonNode loaded = new JsonFileCacheStore(dir.resolve("cache")).load("example").orElseThrow();
        assertEquals(snapshot, loaded);
        String onDisk = Files.readString(dir.resolve("cache/example.json"));
        assertTrue(onDisk.contains("\n"), "cache files are pretty-printed");
    }

    @Test
    void missingEntryMeansFirstRun() throws Exception {
        JsonFileCacheStore store = new JsonFileCacheStore(Files.createTempDirectory("cache-store-missing-"));

        assertTrue(store.load("never-saved").isEmpty());
    }

    @Test
    void corruptEntryIsTreatedAsAbsent() throws Exception {
        Path dir = Files.createTempDirectory("cache-store-corrupt-");
        Files.writeString(dir.resolve("broken.json"), "{ not json");
        Files.writeString(dir.resolve("empty.json"), "");
        JsonFileCacheStore store = new JsonFileCacheStore(dir);

        assertTrue(store.load("broken").isEmpty());
        assertTrue(store.load("empty").isEmpty());
    }

    @Test
    void saveOverwritesPreviousSnapshot() throws Exception {
        JsonFileCacheStore store = new JsonFileCacheStore(Files.createTempDirectory("cache-store-overwrite-"));
        store.save("feed", JsonUtils.objectMapper().readTree("{\"v\":1}"));
        store.save("feed", JsonUtils.objectMapper().readTree("{\"v\":2}"));

        assertEquals(2, store.load("feed").orElseThrow().get("v").asInt());
    }

    @Test
    void unwritableDirectoryReportsFailure() throws Exception {
        Path blocker = Files.createTempFile("cache-store-blocker-", ".txt");
        JsonFileCacheStore store = new JsonFileCacheStore(blocker.resolve("cache"));

        assertFalse(store.save("example", JsonUtils.objectMapper().createObjectNode()));
    }

    @Test
    void idsThatCannotNameAFileAreRejected() throws Exception {
        JsonFileCacheStore store = new JsonFileCacheStore(Files.createTempDirectory("cache-store-ids-"));

        assertThrows(IllegalArgumentException.class, () -> store.load("../escape"));
        assertThrows(IllegalArgumentException.class, () -> store.save("a/b", JsonUtils.objectMapper().createObjectNode()));
    }
}
