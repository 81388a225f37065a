package com.ableclub.monitor.events.model;

/**
 * One (user, event) pair that needs a message in the current cycle. Lives
 * only for the duration of a single notification pass.
 */
public record NotificationObligation(
    Subscription subscription,
    ScrapedEvent event,
    String matchedKeyword
) {
    public long userId() {
        return subscription.userId();
    }

    public String eventId() {
        return event.externalId();
    }
}
