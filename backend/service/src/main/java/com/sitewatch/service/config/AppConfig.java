package com.sitewatch.service.config;

import com.sitewatch.service.delivery.FanOutSettings;
import com.sitewatch.service.runtime.SchedulerSettings;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Contents of {@code config/app.json}. Every field is optional; absent fields take the defaults
 * below.
 */
public record AppConfig(
        String dataDir,
        Integer batchSize,
        Duration checkTimeout,
        Duration sendTimeout,
        Integer workerThreads,
        Integer deliveryThreads,
        Duration shutdownGrace,
        String allSitesDisplayName,
        Boolean exampleSiteEnabled,
        ZoneId zone,
        Duration requestTimeout
) {
    public AppConfig {
        dataDir = dataDir == null || dataDir.isBlank() ? "data" : dataDir;
        batchSize = batchSize == null ? FanOutSettings.DEFAULT_BATCH_SIZE : Math.max(1, batchSize);
        checkTimeout = checkTimeout == null ? Duration.ofSeconds(60) : checkTimeout;
        sendTimeout = sendTimeout == null ? FanOutSettings.DEFAULT_SEND_TIMEOUT : sendTimeout;
        workerThreads = workerThreads == null ? 4 : Math.max(1, workerThreads);
        deliveryThreads = deliveryThreads == null ? 8 : Math.max(1, deliveryThreads);
        shutdownGrace = shutdownGrace == null ? Duration.ofSeconds(5) : shutdownGrace;
        allSitesDisplayName = allSitesDisplayName == null || allSitesDisplayName.isBlank() ? "All" : allSitesDisplayName.trim();
        exampleSiteEnabled = exampleSiteEnabled != null && exampleSiteEnabled;
        zone = zone == null ? ZoneId.systemDefault() : zone;
        requestTimeout = requestTimeout == null ? Duration.ofSeconds(10) : requestTimeout;
    }

    public static AppConfig defaults() {
        return new AppConfig(null, null, null, null, null, null, null, null, null, null, null);
    }

    public Path dataPath() {
        return Path.of(dataDir);
    }

    public SchedulerSettings schedulerSettings() {
        return new SchedulerSettings(zone, checkTimeout, workerThreads, shutdownGrace);
    }

    public FanOutSettings fanOutSettings() {
        return new FanOutSettings(batchSize, sendTimeout);
    }

    public AppConfig withDataDir(String directory) {
        return new AppConfig(directory, batchSize, checkTimeout, sendTimeout, workerThreads, deliveryThreads,
                shutdownGrace, allSitesDisplayName, exampleSiteEnabled, zone, requestTimeout);
    }
}
