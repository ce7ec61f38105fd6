package com.sitewatch.service.subscription;

public enum SubscriptionResult {
    SUBSCRIBED,
    UNSUBSCRIBED,
    NOT_SUBSCRIBED,
    UNKNOWN_SITE,
    STORAGE_FAILURE
}
