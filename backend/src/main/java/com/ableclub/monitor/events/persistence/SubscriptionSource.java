package com.ableclub.monitor.events.persistence;

import com.ableclub.monitor.events.model.Subscription;

import java.util.List;

public interface SubscriptionSource {
    List<Subscription> listActiveSubscriptions();
}
