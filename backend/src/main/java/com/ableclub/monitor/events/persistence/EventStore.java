package com.ableclub.monitor.events.persistence;

import com.ableclub.monitor.events.model.ScrapedEvent;

import java.time.Instant;

public interface EventStore {
    boolean exists(String externalId);

    /**
     * Inserts the event unless its external id is already stored.
     *
     * @return {@code true} when a new row was written
     */
    boolean insert(ScrapedEvent event, Instant discoveredAt);
}
