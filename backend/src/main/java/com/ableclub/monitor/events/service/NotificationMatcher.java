package com.ableclub.monitor.events.service;

import com.ableclub.monitor.events.model.NotificationObligation;
import com.ableclub.monitor.events.model.ScrapedEvent;
import com.ableclub.monitor.events.model.Subscription;
import com.ableclub.monitor.events.util.KeywordMatcher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Pairs newly discovered events with the subscriptions whose keywords they
 * mention. Output order is event order, then subscription order, and holds at
 * most one obligation per (user, event).
 */
@Service
public class NotificationMatcher {

    public List<NotificationObligation> match(List<ScrapedEvent> newEvents, List<Subscription> subscriptions) {
        List<NotificationObligation> obligations = new ArrayList<>();
        if (newEvents == null || newEvents.isEmpty() || subscriptions == null || subscriptions.isEmpty()) {
            return obligations;
        }
        for (ScrapedEvent event : newEvents) {
            Set<Long> notifiedUsers = new HashSet<>();
            for (Subscription subscription : subscriptions) {
                if (notifiedUsers.contains(subscription.userId())) {
                    continue;
                }
                Optional<String> keyword = KeywordMatcher.firstMatch(
                    subscription.keywords(),
                    event.title(),
                    event.body()
                );
                if (keyword.isPresent()) {
                    obligations.add(new NotificationObligation(subscription, event, keyword.get()));
                    notifiedUsers.add(subscription.userId());
                }
            }
        }
        return obligations;
    }
}
