package com.ableclub.monitor.events.service;

import com.ableclub.monitor.events.model.DeliveryResult;
import com.ableclub.monitor.events.model.NotificationObligation;
import com.ableclub.monitor.events.model.RenderedMessage;
import com.ableclub.monitor.events.model.ScrapedEvent;
import com.ableclub.monitor.events.model.Subscription;
import com.ableclub.monitor.events.notify.DispatchFailureException;
import com.ableclub.monitor.events.notify.NotificationDispatcher;
import com.ableclub.monitor.events.notify.NotificationRenderer;
import com.ableclub.monitor.events.persistence.EventStore;
import com.ableclub.monitor.events.persistence.PersistenceException;
import com.ableclub.monitor.events.persistence.SubscriptionSource;
import com.ableclub.monitor.events.scheduler.JobBody;
import com.ableclub.monitor.events.scrape.EventScraper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scrape, persist what is new, then notify every subscriber whose keywords
 * match a newly discovered event.
 *
 * <p>Events are persisted before any message is sent, so an event is
 * announced in the cycle that first sees it and never again. Events stored by
 * an attempt that failed before its notification pass are held until a later
 * attempt gets through one; re-scraping would otherwise find them known and
 * drop them silently.
 */
@Service
public class EventNotificationPipeline implements JobBody {
    private static final Logger log = LoggerFactory.getLogger(EventNotificationPipeline.class);

    public static final String SCRAPED = "scraped";
    public static final String NEW_EVENTS = "new_events";
    public static final String OBLIGATIONS = "obligations";
    public static final String DELIVERED = "delivered";
    public static final String DELIVERY_FAILURES = "delivery_failures";

    private final EventScraper scraper;
    private final EventStore eventStore;
    private final SubscriptionSource subscriptionSource;
    private final NotificationMatcher matcher;
    private final NotificationRenderer renderer;
    private final NotificationDispatcher dispatcher;
    private final Clock clock;
    private final Map<String, ScrapedEvent> awaitingNotification = new LinkedHashMap<>();

    public EventNotificationPipeline(
        EventScraper scraper,
        EventStore eventStore,
        SubscriptionSource subscriptionSource,
        NotificationMatcher matcher,
        NotificationRenderer renderer,
        NotificationDispatcher dispatcher,
        Clock clock
    ) {
        this.scraper = scraper;
        this.eventStore = eventStore;
        this.subscriptionSource = subscriptionSource;
        this.matcher = matcher;
        this.renderer = renderer;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    @Override
    public synchronized Map<String, Integer> run() {
        List<ScrapedEvent> scraped = scraper.fetchCurrentEvents();
        persistNew(scraped);
        List<ScrapedEvent> newEvents = new ArrayList<>(awaitingNotification.values());
        log.info("Scraped {} event(s), {} awaiting notification", scraped.size(), newEvents.size());

        Map<String, Integer> counters = new LinkedHashMap<>();
        counters.put(SCRAPED, scraped.size());
        counters.put(NEW_EVENTS, newEvents.size());
        if (newEvents.isEmpty()) {
            counters.put(OBLIGATIONS, 0);
            counters.put(DELIVERED, 0);
            counters.put(DELIVERY_FAILURES, 0);
            return counters;
        }

        List<Subscription> subscriptions = loadSubscriptions();
        List<NotificationObligation> obligations = matcher.match(newEvents, subscriptions);
        counters.put(OBLIGATIONS, obligations.size());
        // Every obligation is attempted exactly once from here on.
        awaitingNotification.clear();

        int delivered = 0;
        int failed = 0;
        String firstError = null;
        for (NotificationObligation obligation : obligations) {
            DeliveryResult result = deliver(obligation);
            if (result.delivered()) {
                delivered++;
                log.debug("Notified user {} about event {} via {}", obligation.userId(), obligation.eventId(), obligation.subscription().channel());
            } else {
                failed++;
                if (firstError == null) {
                    firstError = result.errorCode();
                }
                log.warn(
                    "Delivery to user {} for event {} via {} failed: {} {}",
                    obligation.userId(),
                    obligation.eventId(),
                    obligation.subscription().channel(),
                    result.errorCode(),
                    result.errorMessage()
                );
            }
        }
        counters.put(DELIVERED, delivered);
        counters.put(DELIVERY_FAILURES, failed);
        log.info("Notification pass done: obligations={} delivered={} failed={}", obligations.size(), delivered, failed);

        if (failed > 0) {
            throw new DispatchFailureException(failed, obligations.size(), firstError);
        }
        return counters;
    }

    private void persistNew(List<ScrapedEvent> scraped) {
        Instant discoveredAt = clock.instant();
        try {
            for (ScrapedEvent event : scraped) {
                if (eventStore.exists(event.externalId())) {
                    continue;
                }
                if (eventStore.insert(event, discoveredAt)) {
                    awaitingNotification.put(event.externalId(), event);
                }
            }
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to persist scraped events", e);
        }
    }

    synchronized int awaitingNotificationCount() {
        return awaitingNotification.size();
    }

    private List<Subscription> loadSubscriptions() {
        try {
            return subscriptionSource.listActiveSubscriptions();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load subscriptions", e);
        }
    }

    private DeliveryResult deliver(NotificationObligation obligation) {
        try {
            RenderedMessage message = renderer.render(obligation);
            return dispatcher.deliver(obligation.subscription().address(), obligation.subscription().channel(), message);
        } catch (RuntimeException e) {
            return DeliveryResult.failure(null, "dispatch_exception", e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
