package com.sitewatch.service.registry;

import com.sitewatch.core.bus.EventBus;
import com.sitewatch.core.events.AlertRaised;
import com.sitewatch.core.model.SiteIds;
import com.sitewatch.service.support.EventCapture;
import com.sitewatch.service.support.StubSite;
import com.sitewatch.sites.api.CheckResult;
import com.sitewatch.sites.api.Site;
import com.sitewatch.sites.api.SiteContext;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SiteRegistryTest {
    private final EventBus bus = new EventBus();
    private final EventCapture events = new EventCapture(bus);
    private final SiteRegistry registry = new SiteRegistry(
            "All", bus, Clock.fixed(Instant.parse("2026-02-09T20:00:00Z"), ZoneOffset.UTC));

    @Test
    void registersValidSiteAndResolvesItsDisplayName() {
        SiteDescriptor descriptor = registry.register("builtin", new StubSite("example", "Example Site", "interval:10"));

        assertEquals("example", descriptor.id());
        assertEquals("builtin", descriptor.source());
        assertTrue(registry.isRegistered("example"));
        assertEquals("example", registry.resolveSiteId("Example Site"));
        assertEquals("example", registry.resolveSiteId("example site"));
        assertEquals("example", registry.resolveSiteId("example"));
        assertEquals("unknown", registry.resolveSiteId("unknown"));
    }

    @Test
    void allSitesDisplayNameAlwaysMapsToTheWildcard() {
        assertEquals(SiteIds.ALL, registry.resolveSiteId("All"));
        registry.register("builtin", new StubSite("a", "Alpha", "interval:10"));
        assertEquals(SiteIds.ALL, registry.resolveSiteId("all"));
    }

    @Test
    void invalidPluginsAreRejectedWithTheFailedCapability() {
        RegistrationException blankName = assertThrows(RegistrationException.class,
                () -> registry.register("builtin", new StubSite("blank", " ", "interval:10")));
        assertTrue(blankName.getMessage().contains("displayName"));

        RegistrationException badId = assertThrows(RegistrationException.class,
                () -> registry.register("builtin", new StubSite("../etc", "Escape", "interval:10")));
        assertTrue(badId.getMessage().contains("../etc"));

        assertThrows(RegistrationException.class, () -> registry.register("builtin", new StubSite("all", "Everything", "interval:10")));
        assertThrows(RegistrationException.class, () -> registry.register("builtin", new StubSite("x", "All", "interval:10")));
        assertThrows(RegistrationException.class, () -> registry.register("builtin", new StubSite("y", "Y", null)));
        assertThrows(RegistrationException.class, () -> registry.register("builtin", null));

        RegistrationException throwing = assertThrows(RegistrationException.class,
                () -> registry.register("builtin", new ThrowingDescriptionSite()));
        assertTrue(throwing.getMessage().contains("description()"));
        assertTrue(registry.all().isEmpty());
    }

    @Test
    void bulkRegistrationSkipsRejectedSitesAndRaisesAlerts() {
        List<SiteDescriptor> accepted = registry.registerAll("config", List.of(
                new StubSite("good", "Good", "interval:10"),
                new StubSite("bad id", "Bad", "interval:10"),
                new StubSite("other", "Other", "0 * * * *")
        ));

        assertEquals(List.of("good", "other"), accepted.stream().map(SiteDescriptor::id).toList());
        List<AlertRaised> alerts = events.alerts(AlertRaised.REGISTRATION);
        assertEquals(1, alerts.size());
        assertEquals("config", alerts.get(0).details().get("source"));
    }

    @Test
    void laterSourceOverridesEarlierDefinition() {
        registry.register("builtin", new StubSite("news", "News", "interval:60"));
        SiteDescriptor override = registry.register("config", new StubSite("news", "Headlines", "0 * * * *"));

        assertEquals(List.of(override), registry.all());
        assertEquals("news", registry.resolveSiteId("Headlines"));
        assertEquals("News", registry.resolveSiteId("News"));
    }

    @Test
    void displayNameOwnedByAnotherSiteIsRejected() {
        registry.register("builtin", new StubSite("one", "Shared", "interval:60"));

        assertThrows(RegistrationException.class, () -> registry.register("config", new StubSite("two", "shared", "interval:60")));
        assertEquals("one", registry.resolveSiteId("Shared"));
    }

    @Test
    void unregisterRemovesSiteAndName() {
        registry.register("builtin", new StubSite("temp", "Temporary", "interval:60"));

        assertTrue(registry.unregister("temp").isPresent());

        assertFalse(registry.isRegistered("temp"));
        assertEquals("Temporary", registry.resolveSiteId("Temporary"));
        assertTrue(registry.unregister("temp").isEmpty());
    }

    private static final class ThrowingDescriptionSite implements Site {
        @Override
        public String id() {
            return "throwing";
        }

        @Override
        public String displayName() {
            return "Throwing";
        }

        @Override
        public String description() {
            throw new UnsupportedOperationException("not implemented");
        }

        @Override
        public String schedule() {
            return "interval:10";
        }

        @Override
        public CompletableFuture<CheckResult> checkUpdates(SiteContext ctx) {
            return CompletableFuture.completedFuture(CheckResult.noUpdates());
        }
    }
}
