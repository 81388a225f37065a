package com.ableclub.monitor.events.model;

public record ScrapedEvent(
    String externalId,
    String title,
    String body,
    String startDate,
    String endDate
) {
}
