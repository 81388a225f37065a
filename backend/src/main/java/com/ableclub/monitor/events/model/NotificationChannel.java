package com.ableclub.monitor.events.model;

import java.util.Locale;

public enum NotificationChannel {
    EMAIL,
    TELEGRAM;

    public static NotificationChannel fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        try {
            return NotificationChannel.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
