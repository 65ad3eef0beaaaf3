package com.finbrain.infrastructure.ai.brain;

/**
 * Retryable remote failure: timeout, connection error or 5xx status.
 */
public class TransientNetworkException extends RuntimeException {

    private final Integer statusCode;

    public TransientNetworkException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    public TransientNetworkException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /** HTTP status, or null when no response was received. */
    public Integer getStatusCode() {
        return statusCode;
    }
}
