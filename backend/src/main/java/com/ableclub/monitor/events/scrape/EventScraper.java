package com.ableclub.monitor.events.scrape;

import com.ableclub.monitor.events.model.ScrapedEvent;

import java.util.List;

public interface EventScraper {
    /**
     * Returns the full current listing of events.
     *
     * @throws ScrapeException when the source cannot be reached or its page
     *     does not look like an event listing
     */
    List<ScrapedEvent> fetchCurrentEvents();
}
