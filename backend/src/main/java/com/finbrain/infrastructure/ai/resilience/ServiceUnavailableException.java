package com.finbrain.infrastructure.ai.resilience;

/**
 * Thrown by {@link CircuitBreaker#guard} when a call is rejected without being attempted.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message) {
        super(message);
    }
}
