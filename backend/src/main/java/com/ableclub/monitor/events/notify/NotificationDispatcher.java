package com.ableclub.monitor.events.notify;

import com.ableclub.monitor.events.model.DeliveryResult;
import com.ableclub.monitor.events.model.NotificationChannel;
import com.ableclub.monitor.events.model.RenderedMessage;

public interface NotificationDispatcher {
    /** Delivers one message. Never throws; failures come back as a result. */
    DeliveryResult deliver(String address, NotificationChannel channel, RenderedMessage message);
}
