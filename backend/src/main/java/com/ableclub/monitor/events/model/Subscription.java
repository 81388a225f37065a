package com.ableclub.monitor.events.model;

import java.util.List;

public record Subscription(
    long userId,
    List<String> keywords,
    NotificationChannel channel,
    String address
) {
    public Subscription {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }
}
