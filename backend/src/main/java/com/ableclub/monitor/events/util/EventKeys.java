package com.ableclub.monitor.events.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

public final class EventKeys {
    private EventKeys() {
    }

    /**
     * Stable identifier for a listed event. The source site exposes no id, so
     * the title and start date together act as the natural key.
     */
    public static String externalId(String title, String startDate) {
        String normalizedTitle = normalize(title);
        String normalizedDate = normalize(startDate);
        return sha256Hex(normalizedTitle + "|" + normalizedDate);
    }

    private static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
