package com.sitewatch.service;

import com.sitewatch.service.config.AppConfig;
import com.sitewatch.service.config.ConfigLoader;
import com.sitewatch.service.config.SitesConfig;
import com.sitewatch.service.delivery.LoggingTransport;
import com.sitewatch.service.runtime.SiteWatchRuntime;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        Path configDir = Path.of(args.length > 0 ? args[0] : "config");

        SiteWatchRuntime runtime;
        try {
            AppConfig appConfig = ConfigLoader.loadApp(configDir);
            SitesConfig sitesConfig = ConfigLoader.loadSites(configDir);
            runtime = new SiteWatchRuntime(appConfig, sitesConfig, new LoggingTransport(), Clock.system(appConfig.zone()));
            runtime.start();
        } catch (IllegalStateException e) {
            LOGGER.log(Level.SEVERE, "Site watch failed to start", e);
            System.exit(1);
            return;
        }

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        SiteWatchRuntime started = runtime;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            started.shutdown();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not read bundled logging.properties; keeping JDK defaults", e);
        }
    }
}
