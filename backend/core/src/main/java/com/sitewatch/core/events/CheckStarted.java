package com.sitewatch.core.events;

import java.time.Instant;

public record CheckStarted(Instant timestamp, String siteId) implements Event {
    @Override
    public String type() {
        return "CheckStarted";
    }
}
