package com.sitewatch.core.events;

import java.time.Instant;

public record CheckCompleted(
        Instant timestamp,
        String siteId,
        boolean success,
        int messageCount,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "CheckCompleted";
    }
}
