package com.ableclub.monitor.events.model;

public record DeliveryResult(
    boolean delivered,
    Integer statusCode,
    String errorCode,
    String errorMessage
) {
    public static DeliveryResult success(Integer statusCode) {
        return new DeliveryResult(true, statusCode, null, null);
    }

    public static DeliveryResult failure(Integer statusCode, String errorCode, String errorMessage) {
        return new DeliveryResult(false, statusCode, errorCode, errorMessage);
    }
}
