package com.example.batchinference.model;

/**
 * What happened when a batch result was posted to a callback endpoint.
 * {@code statusCode} is null when no HTTP response was received.
 */
public record DeliveryOutcome(boolean delivered, int attempts, Integer statusCode, String error) {

    public static DeliveryOutcome delivered(int attempts, int statusCode) {
        return new DeliveryOutcome(true, attempts, statusCode, null);
    }

    public static DeliveryOutcome failed(int attempts, Integer statusCode, String error) {
        return new DeliveryOutcome(false, attempts, statusCode, error);
    }
}
