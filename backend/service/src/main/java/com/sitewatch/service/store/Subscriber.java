package com.sitewatch.service.store;

import java.util.Objects;

/**
 * A resolved recipient. {@code sessionContext} is the opaque token the transport needs to reach
 * the subscriber and is null when none was captured.
 */
public record Subscriber(String id, boolean group, String sessionContext) {
    public Subscriber {
        Objects.requireNonNull(id, "id is required");
    }

    public boolean hasSession() {
        return sessionContext != null && !sessionContext.isBlank();
    }
}
