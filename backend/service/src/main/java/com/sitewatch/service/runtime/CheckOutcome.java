package com.sitewatch.service.runtime;

/**
 * Result of one trigger. {@code messages} counts what the site returned, {@code delivered} the
 * successful sends across all of them.
 */
public record CheckOutcome(Status status, int messages, int delivered) {
    public enum Status {
        /** Another check of the same site was still running. */
        DROPPED_IN_FLIGHT,
        NO_SUBSCRIBERS,
        FAILED,
        COMPLETED,
        /** The site was unregistered or replaced while its check ran. */
        DISCARDED,
        UNKNOWN_SITE
    }

    static CheckOutcome of(Status status) {
        return new CheckOutcome(status, 0, 0);
    }
}
