package com.example.batchinference.exception;

/**
 * Startup-time configuration problem (missing model artifact, unreadable label
 * file, unusable model outputs). Thrown while the context is being built so the
 * service never reports itself healthy.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
