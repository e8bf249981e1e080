package com.example.batchinference.exception;

public class CallbackDeliveryException extends RuntimeException {

    private final Integer statusCode;

    public CallbackDeliveryException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
