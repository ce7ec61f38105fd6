package com.sitewatch.core.events;

import java.time.Instant;

public record NotificationDelivered(
        Instant timestamp,
        String siteId,
        String subscriberId,
        boolean group
) implements Event {
    @Override
    public String type() {
        return "NotificationDelivered";
    }
}
