package com.ableclub.monitor.events.model;

import java.util.List;

public record ScrapedEventPage(
    long total,
    int skip,
    int limit,
    List<ScrapedEvent> events
) {
}
