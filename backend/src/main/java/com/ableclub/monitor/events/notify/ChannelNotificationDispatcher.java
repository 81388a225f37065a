package com.ableclub.monitor.events.notify;

import com.ableclub.monitor.events.model.DeliveryResult;
import com.ableclub.monitor.events.model.NotificationChannel;
import com.ableclub.monitor.events.model.RenderedMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
public class ChannelNotificationDispatcher implements NotificationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ChannelNotificationDispatcher.class);

    private final Map<NotificationChannel, ChannelTransport> transports = new EnumMap<>(NotificationChannel.class);

    public ChannelNotificationDispatcher(List<ChannelTransport> transports) {
        for (ChannelTransport transport : transports) {
            ChannelTransport previous = this.transports.put(transport.channel(), transport);
            if (previous != null) {
                throw new IllegalStateException("Two transports registered for channel " + transport.channel());
            }
        }
    }

    @Override
    public DeliveryResult deliver(String address, NotificationChannel channel, RenderedMessage message) {
        if (address == null || address.isBlank()) {
            return DeliveryResult.failure(null, "missing_address", "No address for channel " + channel);
        }
        ChannelTransport transport = channel == null ? null : transports.get(channel);
        if (transport == null) {
            return DeliveryResult.failure(null, "unsupported_channel", "No transport for channel " + channel);
        }
        try {
            DeliveryResult result = transport.send(address, message);
            return result == null
                ? DeliveryResult.failure(null, "no_result", "Transport returned no result")
                : result;
        } catch (Exception e) {
            log.warn("Transport {} threw while delivering to {}", channel, address, e);
            return DeliveryResult.failure(null, "transport_exception", e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
