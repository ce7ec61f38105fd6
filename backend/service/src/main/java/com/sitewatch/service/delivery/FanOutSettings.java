package com.sitewatch.service.delivery;

import java.time.Duration;
import java.util.Objects;

public record FanOutSettings(int batchSize, Duration sendTimeout) {
    public static final int DEFAULT_BATCH_SIZE = 50;
    public static final Duration DEFAULT_SEND_TIMEOUT = Duration.ofSeconds(10);

    public FanOutSettings {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        Objects.requireNonNull(sendTimeout, "sendTimeout is required");
        if (sendTimeout.isNegative() || sendTimeout.isZero()) {
            throw new IllegalArgumentException("sendTimeout must be positive");
        }
    }

    public static FanOutSettings defaults() {
        return new FanOutSettings(DEFAULT_BATCH_SIZE, DEFAULT_SEND_TIMEOUT);
    }
}
