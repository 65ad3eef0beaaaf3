package com.finbrain.infrastructure.ai.resilience;

public class GateTimeoutException extends RuntimeException {

    public GateTimeoutException(String message) {
        super(message);
    }

    public GateTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
