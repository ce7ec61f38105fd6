package com.sitewatch.core.model;

import java.util.regex.Pattern;

public final class SiteIds {
    /** Subscription entry that matches every registered site, present and future. */
    public static final String ALL = "all";

    private static final Pattern VALID = Pattern.compile("[A-Za-z0-9_.-]+");

    private SiteIds() {
    }

    /**
     * Site ids name cache files, so they are limited to a filename-safe alphabet.
     */
    public static boolean isValid(String id) {
        return id != null && VALID.matcher(id).matches() && !".".equals(id) && !"..".equals(id);
    }

    public static String requireValid(String id) {
        if (!isValid(id)) {
            throw new IllegalArgumentException("Invalid site id: " + id);
        }
        return id;
    }
}
