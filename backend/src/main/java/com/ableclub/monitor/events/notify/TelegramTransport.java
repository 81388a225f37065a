package com.ableclub.monitor.events.notify;

import com.ableclub.monitor.config.MonitorProperties;
import com.ableclub.monitor.events.model.DeliveryResult;
import com.ableclub.monitor.events.model.NotificationChannel;
import com.ableclub.monitor.events.model.RenderedMessage;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/** Bot API {@code sendMessage}; the subscription address is the chat id. */
@Component
public class TelegramTransport implements ChannelTransport {
    private final MonitorProperties.Telegram properties;
    private final JsonPostClient client;

    public TelegramTransport(MonitorProperties properties, JsonPostClient client) {
        this.properties = properties.getNotify().getTelegram();
        this.client = client;
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.TELEGRAM;
    }

    @Override
    public DeliveryResult send(String address, RenderedMessage message) {
        if (!properties.isConfigured()) {
            return DeliveryResult.failure(null, "transport_not_configured", "Telegram bot token is not set");
        }
        String base = properties.getApiBaseUrl().trim();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chat_id", address.trim());
        payload.put("text", message.subject() == null ? message.body() : message.subject() + "\n\n" + message.body());
        payload.put("disable_web_page_preview", true);
        return client.post(base + "/bot" + properties.getBotToken().trim() + "/sendMessage", payload, Map.of());
    }
}
