package com.sitewatch.service.delivery;

/**
 * How the host reaches a subscriber. Implementations may block; the fan-out bounds every call
 * with its send timeout.
 */
public interface Transport {
    /** @return true when the text was handed to the recipient's channel */
    boolean send(String sessionContext, String text);
}
