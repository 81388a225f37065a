package com.ableclub.monitor.events.api;

import com.ableclub.monitor.events.model.ScrapedEventPage;
import com.ableclub.monitor.events.persistence.JdbcEventStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/events")
public class EventController {
    private static final int MAX_LIMIT = 100;

    private final JdbcEventStore eventStore;

    public EventController(JdbcEventStore eventStore) {
        this.eventStore = eventStore;
    }

    @GetMapping
    public ScrapedEventPage list(
        @RequestParam(name = "skip", required = false, defaultValue = "0") int skip,
        @RequestParam(name = "limit", required = false, defaultValue = "20") int limit
    ) {
        int safeSkip = Math.max(0, skip);
        int safeLimit = Math.max(1, Math.min(limit, MAX_LIMIT));
        return new ScrapedEventPage(
            eventStore.countEvents(),
            safeSkip,
            safeLimit,
            eventStore.findRecent(safeSkip, safeLimit)
        );
    }
}
