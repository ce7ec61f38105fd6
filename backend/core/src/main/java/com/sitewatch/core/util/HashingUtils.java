package com.sitewatch.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class HashingUtils {
    private HashingUtils() {
    }

    /**
     * Lowercase hex MD5 of the UTF-8 bytes. Used as the dedup key of a message, so the value
     * must stay stable across releases or previously recorded sends stop matching.
     */
    public static String md5(String text) {
        return hexDigest("MD5", text);
    }

    public static String sha256(String text) {
        return hexDigest("SHA-256", text);
    }

    private static String hexDigest(String algorithm, String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance(algorithm);
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }
}
