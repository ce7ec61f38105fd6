package com.sitewatch.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.sitewatch.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;

public final class ConfigLoader {
    public static final String APP_FILE = "app.json";
    public static final String SITES_FILE = "sites.json";

    private ConfigLoader() {
    }

    /** A missing {@code app.json} means all defaults. */
    public static AppConfig loadApp(Path configDir) {
        return readOptional(configDir.resolve(APP_FILE), new TypeReference<>() {
        }, AppConfig::defaults);
    }

    /** A missing {@code sites.json} means no configured sites. */
    public static SitesConfig loadSites(Path configDir) {
        return readOptional(configDir.resolve(SITES_FILE), new TypeReference<>() {
        }, SitesConfig::empty);
    }

    private static <T> T readOptional(Path path, TypeReference<T> ref, Supplier<T> whenMissing) {
        if (!Files.exists(path)) {
            return whenMissing.get();
        }
        try (InputStream in = Files.newInputStream(path)) {
            T value = JsonUtils.objectMapper().readValue(in, ref);
            return value == null ? whenMissing.get() : value;
        } catch (IOException | RuntimeException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
