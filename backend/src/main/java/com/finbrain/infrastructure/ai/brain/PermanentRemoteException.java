package com.finbrain.infrastructure.ai.brain;

/**
 * Non-retryable remote failure: 4xx status or an unreadable response envelope.
 */
public class PermanentRemoteException extends RuntimeException {

    public PermanentRemoteException(String message) {
        super(message);
    }

    public PermanentRemoteException(String message, Throwable cause) {
        super(message, cause);
    }
}
