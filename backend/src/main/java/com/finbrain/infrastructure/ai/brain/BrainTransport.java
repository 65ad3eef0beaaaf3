package com.finbrain.infrastructure.ai.brain;

import java.time.Duration;

/**
 * Wire access to the remote AI Brain.
 */
public interface BrainTransport {

    /**
     * Send one query, bounded by {@code timeout}.
     *
     * @throws TransientNetworkException on timeout, I/O error or retryable status
     * @throws PermanentRemoteException  on client error status or an unreadable envelope
     */
    BrainReply query(BrainQuery query, Duration timeout);

    /**
     * Liveness check. Never throws.
     */
    boolean isHealthy(Duration timeout);
}
