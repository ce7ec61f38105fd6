package com.sitewatch.service.registry;

public class RegistrationException extends RuntimeException {
    private final String siteName;

    public RegistrationException(String siteName, String message) {
        super(message);
        this.siteName = siteName;
    }

    public RegistrationException(String siteName, String message, Throwable cause) {
        super(message, cause);
        this.siteName = siteName;
    }

    public String siteName() {
        return siteName;
    }
}
