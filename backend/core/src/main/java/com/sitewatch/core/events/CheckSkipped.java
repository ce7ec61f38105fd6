package com.sitewatch.core.events;

import java.time.Instant;

public record CheckSkipped(Instant timestamp, String siteId, Reason reason) implements Event {
    public enum Reason {
        IN_FLIGHT,
        NO_SUBSCRIBERS
    }

    @Override
    public String type() {
        return "CheckSkipped";
    }
}
