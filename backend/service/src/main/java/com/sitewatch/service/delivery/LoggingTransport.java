package com.sitewatch.service.delivery;

import java.util.logging.Logger;

/** Development transport that writes each notification to the log instead of a chat channel. */
public class LoggingTransport implements Transport {
    private static final Logger LOGGER = Logger.getLogger(LoggingTransport.class.getName());

    @Override
    public boolean send(String sessionContext, String text) {
        LOGGER.info("-> " + sessionContext + "\n" + text);
        return true;
    }
}
