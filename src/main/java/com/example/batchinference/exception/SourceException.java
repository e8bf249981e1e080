package com.example.batchinference.exception;

/**
 * Raised when an image source cannot be turned into decoded pixels. Scoped to a
 * single item of a batch: the orchestrator converts it into a failure outcome
 * for that source only.
 */
public class SourceException extends RuntimeException {

    public enum Reason {
        UNSUPPORTED_SCHEME,
        MALFORMED_SOURCE,
        NOT_FOUND,
        TRANSPORT,
        DECODE,
        STORAGE_UNAVAILABLE
    }

    private final String source;
    private final Reason reason;

    public SourceException(String source, Reason reason, String message) {
        this(source, reason, message, null);
    }

    public SourceException(String source, Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.reason = reason;
    }

    public String getSource() {
        return source;
    }

    public Reason getReason() {
        return reason;
    }
}
