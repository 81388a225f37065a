package com.ableclub.monitor.events.notify;

import com.ableclub.monitor.config.MonitorProperties;
import com.ableclub.monitor.events.model.DeliveryResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Posts a JSON document and turns the response into a {@link DeliveryResult}.
 * Transport errors are reported, not thrown.
 */
@Component
public class JsonPostClient {
    private static final int MAX_ERROR_BODY = 300;

    private final HttpClient client;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public JsonPostClient(HttpClient deliveryHttpClient, ObjectMapper objectMapper, MonitorProperties properties) {
        this.client = deliveryHttpClient;
        this.objectMapper = objectMapper;
        this.timeout = Duration.ofSeconds(properties.getNotify().getRequestTimeoutSeconds());
    }

    public DeliveryResult post(String url, Map<String, Object> payload, Map<String, String> headers) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return DeliveryResult.failure(null, "invalid_url", e.getMessage());
        }
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            return DeliveryResult.failure(null, "serialization_error", e.getOriginalMessage());
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        if (headers != null) {
            headers.forEach(builder::header);
        }

        try {
            HttpResponse<String> response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            int status = response.statusCode();
            if (status >= 200 && status < 300) {
                return DeliveryResult.success(status);
            }
            return DeliveryResult.failure(status, "http_" + status, abbreviate(response.body()));
        } catch (HttpTimeoutException e) {
            return DeliveryResult.failure(null, "timeout", e.getMessage());
        } catch (IOException e) {
            return DeliveryResult.failure(null, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeliveryResult.failure(null, "interrupted", e.getMessage());
        }
    }

    private String abbreviate(String value) {
        if (value == null || value.length() <= MAX_ERROR_BODY) {
            return value;
        }
        return value.substring(0, MAX_ERROR_BODY);
    }
}
