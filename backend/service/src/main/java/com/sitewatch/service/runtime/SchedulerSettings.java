package com.sitewatch.service.runtime;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

public record SchedulerSettings(ZoneId zone, Duration checkTimeout, int workerThreads, Duration shutdownGrace) {
    public SchedulerSettings {
        Objects.requireNonNull(zone, "zone is required");
        Objects.requireNonNull(checkTimeout, "checkTimeout is required");
        Objects.requireNonNull(shutdownGrace, "shutdownGrace is required");
        if (checkTimeout.isNegative() || checkTimeout.isZero()) {
            throw new IllegalArgumentException("checkTimeout must be positive");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1");
        }
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(ZoneId.systemDefault(), Duration.ofSeconds(60), 4, Duration.ofSeconds(5));
    }
}
