package com.sitewatch.service.runtime;

import com.sitewatch.core.bus.EventBus;
import com.sitewatch.service.config.AppConfig;
import com.sitewatch.service.config.SitesConfig;
import com.sitewatch.service.delivery.NotificationFanOut;
import com.sitewatch.service.delivery.Transport;
import com.sitewatch.service.http.HttpClientFactory;
import com.sitewatch.service.registry.SiteDescriptor;
import com.sitewatch.service.registry.SiteRegistry;
import com.sitewatch.service.status.SiteStatusTracker;
import com.sitewatch.service.store.JsonFileCacheStore;
import com.sitewatch.service.store.JsonFileDedupStore;
import com.sitewatch.service.store.JsonFileSubscriptionStore;
import com.sitewatch.service.subscription.SubscriptionService;
import com.sitewatch.sites.api.Site;
import com.sitewatch.sites.api.SiteContext;
import com.sitewatch.sites.example.ExampleSite;
import com.sitewatch.sites.rss.RssFeedSite;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Builds and owns every long-lived object. {@link #start()} loads the site sources in priority
 * order and schedules what they register; {@link #shutdown()} stops scheduling and delivery.
 */
public class SiteWatchRuntime {
    public static final String BUILTIN_SOURCE = "builtin";
    public static final String CONFIG_SOURCE = "config";

    private static final Logger LOGGER = Logger.getLogger(SiteWatchRuntime.class.getName());

    private final AppConfig appConfig;
    private final SitesConfig sitesConfig;
    private final Supplier<List<Site>> pluginDiscovery;
    private final EventBus eventBus = new EventBus();
    private final SiteRegistry registry;
    private final JsonFileCacheStore cacheStore;
    private final ExecutorService deliveryExecutor;
    private final SchedulerService scheduler;
    private final SubscriptionService subscriptions;
    private final SiteStatusTracker status;
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();

    public SiteWatchRuntime(AppConfig appConfig, SitesConfig sitesConfig, Transport transport, Clock clock) {
        this(appConfig, sitesConfig, transport, clock, SiteWatchRuntime::discoverPlugins);
    }

    SiteWatchRuntime(
            AppConfig appConfig,
            SitesConfig sitesConfig,
            Transport transport,
            Clock clock,
            Supplier<List<Site>> pluginDiscovery
    ) {
        this.appConfig = appConfig;
        this.sitesConfig = sitesConfig;
        this.pluginDiscovery = pluginDiscovery;
        Path dataDir = appConfig.dataPath();
        this.status = new SiteStatusTracker(eventBus);
        this.registry = new SiteRegistry(appConfig.allSitesDisplayName(), eventBus, clock);
        this.cacheStore = new JsonFileCacheStore(dataDir.resolve("cache"));
        JsonFileSubscriptionStore subscriptionStore = new JsonFileSubscriptionStore(dataDir.resolve("subscriptions.json"), registry::isRegistered);
        JsonFileDedupStore dedupStore = new JsonFileDedupStore(dataDir.resolve("sent_messages.json"), clock);
        this.deliveryExecutor = Executors.newFixedThreadPool(appConfig.deliveryThreads());
        NotificationFanOut fanOut = new NotificationFanOut(
                dedupStore, transport, eventBus, clock, appConfig.fanOutSettings(), deliveryExecutor);
        HttpClient httpClient = HttpClientFactory.create(appConfig.requestTimeout());
        SiteContextFactory contexts = site -> new SiteContext(
                cacheStore, httpClient, clock, appConfig.requestTimeout(), Map.of());
        this.scheduler = new SchedulerService(
                subscriptionStore, fanOut, contexts, eventBus, clock, appConfig.schedulerSettings());
        this.subscriptions = new SubscriptionService(subscriptionStore, registry, eventBus, clock);
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        List<Site> builtin = new ArrayList<>(pluginDiscovery.get());
        if (appConfig.exampleSiteEnabled()) {
            builtin.add(new ExampleSite());
        }
        addSites(BUILTIN_SOURCE, builtin);
        addSites(CONFIG_SOURCE, sitesConfig.rss().stream().<Site>map(RssFeedSite::new).toList());
        LOGGER.info("Site watch started with " + registry.all().size() + " site(s), "
                + scheduler.scheduledSites().size() + " scheduled");
    }

    /**
     * Registers and schedules a batch of sites. A site whose id is already known replaces the
     * earlier definition and its job.
     */
    public List<SiteDescriptor> addSites(String source, List<? extends Site> sites) {
        List<SiteDescriptor> accepted = registry.registerAll(source, sites);
        for (SiteDescriptor site : accepted) {
            scheduler.register(site);
        }
        return accepted;
    }

    public boolean removeSite(String siteId) {
        boolean cancelled = scheduler.unregister(siteId);
        return registry.unregister(siteId).isPresent() || cancelled;
    }

    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        scheduler.shutdown();
        deliveryExecutor.shutdown();
        try {
            if (!deliveryExecutor.awaitTermination(appConfig.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                deliveryExecutor.shutdownNow();
                LOGGER.warning("Abandoned notification sends still running at shutdown");
            }
        } catch (InterruptedException e) {
            deliveryExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Site watch stopped");
    }

    public SubscriptionService subscriptions() {
        return subscriptions;
    }

    public SiteRegistry registry() {
        return registry;
    }

    public SchedulerService scheduler() {
        return scheduler;
    }

    public SiteStatusTracker status() {
        return status;
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public JsonFileCacheStore cacheStore() {
        return cacheStore;
    }

    /**
     * Sites provided on the class path through {@code META-INF/services/com.sitewatch.sites.api.Site}.
     * A provider that cannot be instantiated is skipped.
     */
    static List<Site> discoverPlugins() {
        List<Site> sites = new ArrayList<>();
        Iterator<Site> providers = ServiceLoader.load(Site.class).iterator();
        while (true) {
            try {
                if (!providers.hasNext()) {
                    break;
                }
                sites.add(providers.next());
            } catch (ServiceConfigurationError e) {
                LOGGER.warning("Skipping site plugin that failed to load: " + e.getMessage());
            }
        }
        return sites;
    }
}
