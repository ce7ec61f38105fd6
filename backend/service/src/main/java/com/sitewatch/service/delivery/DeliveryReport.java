package com.sitewatch.service.delivery;

/**
 * What happened to one message. A duplicate is sent to nobody; otherwise every reachable
 * subscriber counts as either sent or failed.
 */
public record DeliveryReport(boolean duplicate, int sent, int failed, int skippedWithoutSession) {
    static DeliveryReport duplicate(int skippedWithoutSession) {
        return new DeliveryReport(true, 0, 0, skippedWithoutSession);
    }
}
