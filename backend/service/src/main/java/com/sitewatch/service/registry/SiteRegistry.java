package com.sitewatch.service.registry;

import com.sitewatch.core.bus.EventBus;
import com.sitewatch.core.events.AlertRaised;
import com.sitewatch.core.model.SiteIds;
import com.sitewatch.sites.api.Site;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Validated sites keyed by id, plus the display-name lookup users subscribe with. Sources are
 * registered in priority order; a later registration of the same id replaces the earlier one.
 */
public class SiteRegistry {
    private static final Logger LOGGER = Logger.getLogger(SiteRegistry.class.getName());

    private final String allSitesDisplayName;
    private final EventBus eventBus;
    private final Clock clock;
    private final Object lock = new Object();
    private final Map<String, SiteDescriptor> sitesById = new LinkedHashMap<>();
    private final Map<String, String> idsByDisplayName = new LinkedHashMap<>();

    public SiteRegistry(String allSitesDisplayName, EventBus eventBus, Clock clock) {
        if (allSitesDisplayName == null || allSitesDisplayName.isBlank()) {
            throw new IllegalArgumentException("allSitesDisplayName is required");
        }
        this.allSitesDisplayName = allSitesDisplayName;
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Validates and registers one site.
     *
     * @throws RegistrationException when the site does not satisfy the capability contract or its
     *                               display name belongs to another site
     */
    public SiteDescriptor register(String source, Site site) {
        SiteDescriptor descriptor = validate(source, site);
        synchronized (lock) {
            String owner = idsByDisplayName.get(normalize(descriptor.displayName()));
            if (owner != null && !owner.equals(descriptor.id())) {
                throw new RegistrationException(descriptor.id(),
                        "Site " + descriptor.id() + " display name '" + descriptor.displayName() + "' is already used by " + owner);
            }
            SiteDescriptor previous = sitesById.put(descriptor.id(), descriptor);
            if (previous != null) {
                idsByDisplayName.remove(normalize(previous.displayName()));
                LOGGER.info("Site " + descriptor.id() + " from " + source + " overrides definition from " + previous.source());
            } else {
                LOGGER.info("Registered site " + descriptor.id() + " (" + descriptor.displayName() + ") from " + source);
            }
            idsByDisplayName.put(normalize(descriptor.displayName()), descriptor.id());
        }
        return descriptor;
    }

    /**
     * Registers every site of one source. Rejected sites are logged and reported on the bus; they
     * never stop the rest of the source from loading.
     */
    public List<SiteDescriptor> registerAll(String source, List<? extends Site> sites) {
        List<SiteDescriptor> accepted = new ArrayList<>();
        for (Site site : sites) {
            try {
                accepted.add(register(source, site));
            } catch (RegistrationException e) {
                LOGGER.warning("Rejected site " + e.siteName() + " from " + source + ": " + e.getMessage());
                eventBus.publish(new AlertRaised(
                        clock.instant(),
                        AlertRaised.REGISTRATION,
                        e.getMessage(),
                        Map.of("site", e.siteName(), "source", source)
                ));
            }
        }
        return List.copyOf(accepted);
    }

    public Optional<SiteDescriptor> unregister(String siteId) {
        synchronized (lock) {
            SiteDescriptor removed = sitesById.remove(siteId);
            if (removed != null) {
                idsByDisplayName.remove(normalize(removed.displayName()));
                LOGGER.info("Unregistered site " + siteId);
            }
            return Optional.ofNullable(removed);
        }
    }

    public Optional<SiteDescriptor> find(String siteId) {
        synchronized (lock) {
            return Optional.ofNullable(sitesById.get(siteId));
        }
    }

    public boolean isRegistered(String siteId) {
        synchronized (lock) {
            return siteId != null && sitesById.containsKey(siteId);
        }
    }

    /** Registered sites in registration order. */
    public List<SiteDescriptor> all() {
        synchronized (lock) {
            return List.copyOf(sitesById.values());
        }
    }

    /**
     * Maps a name a user typed to a site id: the all-sites display name to {@code all}, a known
     * display name (case-insensitive) to its id, anything else unchanged.
     */
    public String resolveSiteId(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim();
        if (trimmed.equalsIgnoreCase(allSitesDisplayName)) {
            return SiteIds.ALL;
        }
        synchronized (lock) {
            return idsByDisplayName.getOrDefault(normalize(trimmed), trimmed);
        }
    }

    public String allSitesDisplayName() {
        return allSitesDisplayName;
    }

    private SiteDescriptor validate(String source, Site site) {
        if (site == null) {
            throw new RegistrationException("<null>", "Site from " + source + " is null");
        }
        String label = site.getClass().getName();
        String id = capability(label, "id", site::id);
        label = id;
        if (!SiteIds.isValid(id)) {
            throw new RegistrationException(label, "Site id '" + id + "' must match [A-Za-z0-9_.-]+");
        }
        if (SiteIds.ALL.equalsIgnoreCase(id)) {
            throw new RegistrationException(label, "Site id '" + id + "' is reserved");
        }
        String displayName = capability(label, "displayName", site::displayName);
        if (displayName.trim().equalsIgnoreCase(allSitesDisplayName)) {
            throw new RegistrationException(label, "Site " + id + " display name '" + displayName + "' is reserved");
        }
        String description = capability(label, "description", site::description);
        String schedule = capability(label, "schedule", site::schedule);
        return new SiteDescriptor(id, displayName.trim(), description, schedule.trim(), source, site);
    }

    private static String capability(String label, String name, Supplier<String> accessor) {
        String value;
        try {
            value = accessor.get();
        } catch (RuntimeException e) {
            throw new RegistrationException(label, "Site " + label + " failed " + name + "(): " + e.getMessage(), e);
        }
        if (value == null || value.isBlank()) {
            throw new RegistrationException(label, "Site " + label + " returned a blank " + name + "()");
        }
        return value;
    }

    private static String normalize(String displayName) {
        return displayName.trim().toLowerCase(Locale.ROOT);
    }
}
