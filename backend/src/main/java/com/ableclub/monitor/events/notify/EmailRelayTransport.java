package com.ableclub.monitor.events.notify;

import com.ableclub.monitor.config.MonitorProperties;
import com.ableclub.monitor.events.model.DeliveryResult;
import com.ableclub.monitor.events.model.NotificationChannel;
import com.ableclub.monitor.events.model.RenderedMessage;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/** Hands email off to an HTTP mail relay. */
@Component
public class EmailRelayTransport implements ChannelTransport {
    private final MonitorProperties.Email properties;
    private final JsonPostClient client;

    public EmailRelayTransport(MonitorProperties properties, JsonPostClient client) {
        this.properties = properties.getNotify().getEmail();
        this.client = client;
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.EMAIL;
    }

    @Override
    public DeliveryResult send(String address, RenderedMessage message) {
        if (!properties.isConfigured()) {
            return DeliveryResult.failure(null, "transport_not_configured", "Email relay URL is not set");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from", properties.getFromAddress());
        payload.put("to", address.trim());
        payload.put("subject", message.subject());
        payload.put("text", message.body());
        Map<String, String> headers = properties.getApiKey() == null || properties.getApiKey().isBlank()
            ? Map.of()
            : Map.of("Authorization", "Bearer " + properties.getApiKey().trim());
        return client.post(properties.getRelayUrl().trim(), payload, headers);
    }
}
