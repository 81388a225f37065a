package com.ableclub.monitor.events.model;

public record RenderedMessage(
    String subject,
    String body
) {
}
