package com.sitewatch.service.runtime;

import com.sitewatch.service.registry.SiteDescriptor;
import com.sitewatch.sites.api.SiteContext;

@FunctionalInterface
public interface SiteContextFactory {
    SiteContext contextFor(SiteDescriptor site);
}
