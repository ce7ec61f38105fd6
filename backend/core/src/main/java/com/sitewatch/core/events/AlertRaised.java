package com.sitewatch.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An isolated failure worth surfacing. Categories in use: {@code registration}, {@code schedule},
 * {@code check}, {@code delivery}, {@code storage}.
 */
public record AlertRaised(
        Instant timestamp,
        String category,
        String message,
        Map<String, Object> details
) implements Event {
    public static final String REGISTRATION = "registration";
    public static final String SCHEDULE = "schedule";
    public static final String CHECK = "check";
    public static final String DELIVERY = "delivery";
    public static final String STORAGE = "storage";

    @Override
    public String type() {
        return "AlertRaised";
    }
}
