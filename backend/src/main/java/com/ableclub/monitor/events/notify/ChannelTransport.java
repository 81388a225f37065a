package com.ableclub.monitor.events.notify;

import com.ableclub.monitor.events.model.DeliveryResult;
import com.ableclub.monitor.events.model.NotificationChannel;
import com.ableclub.monitor.events.model.RenderedMessage;

public interface ChannelTransport {
    NotificationChannel channel();

    DeliveryResult send(String address, RenderedMessage message);
}
