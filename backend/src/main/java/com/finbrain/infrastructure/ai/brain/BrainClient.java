package com.finbrain.infrastructure.ai.brain;

import com.finbrain.domain.inference.model.BrainResponse;
import com.finbrain.domain.inference.model.BrainResult;
import com.finbrain.domain.inference.model.ClassificationRequest;
import com.finbrain.domain.inference.model.ConfidenceResult;
import com.finbrain.domain.inference.model.ConfidenceSignals;
import com.finbrain.domain.inference.model.DegradationReason;
import com.finbrain.domain.inference.model.InferenceMode;
import com.finbrain.domain.inference.model.ValidationIssue;
import com.finbrain.domain.inference.model.ValidationResult;
import com.finbrain.infrastructure.ai.cache.BrainResponseCache;
import com.finbrain.infrastructure.ai.cache.CachedBrainResponse;
import com.finbrain.infrastructure.ai.confidence.ConfidenceScorer;
import com.finbrain.infrastructure.ai.preprocessing.TextNormalizer;
import com.finbrain.infrastructure.ai.resilience.BackoffPolicy;
import com.finbrain.infrastructure.ai.resilience.CircuitBreaker;
import com.finbrain.infrastructure.ai.resilience.Deadline;
import com.finbrain.infrastructure.ai.resilience.DeadlineExceededException;
import com.finbrain.infrastructure.ai.resilience.GateTimeoutException;
import com.finbrain.infrastructure.ai.resilience.RequestGate;
import com.finbrain.infrastructure.ai.resilience.ServiceUnavailableException;
import com.finbrain.infrastructure.ai.resilience.Sleeper;
import com.finbrain.infrastructure.ai.validation.CategoryTaxonomy;
import com.finbrain.infrastructure.ai.validation.ResponseValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Resilient client of the remote AI Brain.
 * <p>
 * Call path: cache lookup, admission gate, circuit breaker around the whole retry loop, remote call,
 * validation, scoring, cache write. Every failure along the way produces a degraded result carrying a
 * rule-based fallback answer; callers never see an exception. A cache hit is served only after its content
 * passes validation against the caller's own source facts. The gate permit is released on every path.
 * <p>
 * Breaker accounting: any exception escaping the retry loop is one failure. A reply that arrives but fails
 * validation is a remote success.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BrainClient {

    private final BrainTransport transport;
    private final CircuitBreaker brainCircuitBreaker;
    private final RequestGate brainRequestGate;
    private final BackoffPolicy brainBackoffPolicy;
    private final Sleeper sleeper;
    private final BrainResponseCache cache;
    private final ResponseValidator validator;
    private final ConfidenceScorer scorer;
    private final CategoryTaxonomy taxonomy;
    private final FallbackResponder fallbackResponder;
    private final TextNormalizer normalizer;
    private final BrainMetricsTracker metrics;
    private final BrainProperties properties;
    private final Clock clock;

    public BrainResult classify(ClassificationRequest request) {
        return classify(request, Deadline.after(properties.getOverallTimeout(), clock));
    }

    public BrainResult classify(ClassificationRequest request, Deadline deadline) {
        metrics.recordRequest();
        InferenceMode mode = request.mode();
        String query = normalizer.normalize(request.query());

        Optional<BrainResult> hit = fromCache(request, query);
        if (hit.isPresent()) {
            return hit.get();
        }

        if (deadline.expired()) {
            return degrade(request, DegradationReason.DEADLINE_EXCEEDED, List.of());
        }

        long start = clock.millis();
        BrainQuery wireQuery = new BrainQuery(query, mode.wireName(), request.context(), null);
        BrainReply reply;
        Duration gateWait = deadline.bound(properties.getGate().getAcquireTimeout());
        try (RequestGate.Permit permit = brainRequestGate.acquire(gateWait)) {
            reply = brainCircuitBreaker.guard(() -> callWithRetry(wireQuery, deadline));
        } catch (GateTimeoutException e) {
            return degrade(request, DegradationReason.GATE_TIMEOUT, List.of());
        } catch (ServiceUnavailableException e) {
            return degrade(request, DegradationReason.CIRCUIT_OPEN, List.of());
        } catch (DeadlineExceededException e) {
            return degrade(request, DegradationReason.DEADLINE_EXCEEDED, List.of());
        } catch (TransientNetworkException | PermanentRemoteException e) {
            log.warn("[BrainClient] {} call failed: {}", mode, e.getMessage());
            return degrade(request, DegradationReason.REMOTE_FAILURE, List.of());
        } catch (RuntimeException e) {
            log.error("[BrainClient] Unexpected failure during {} call", mode, e);
            return degrade(request, DegradationReason.REMOTE_FAILURE, List.of());
        }

        try {
            return accept(request, query, reply, clock.millis() - start);
        } catch (RuntimeException e) {
            log.error("[BrainClient] Failed to accept {} reply", mode, e);
            return degrade(request, DegradationReason.VALIDATION_FAILED, List.of());
        }
    }

    /**
     * A cached answer is served only if it still validates against this caller's source facts.
     */
    private Optional<BrainResult> fromCache(ClassificationRequest request, String query) {
        InferenceMode mode = request.mode();
        Optional<CachedBrainResponse> cached = cache.get(mode, query);
        if (cached.isEmpty()) {
            return Optional.empty();
        }
        ValidationResult recheck;
        try {
            recheck = validator.validate(cached.get().content(), mode, request.sourceFacts());
        } catch (RuntimeException e) {
            log.warn("[BrainClient] Could not recheck cached {} answer, ignoring it: {}", mode, e.getMessage());
            return Optional.empty();
        }
        if (!recheck.safe()) {
            log.info("[BrainClient] Cached {} answer does not hold for the caller's facts: {}",
                    mode, recheck.issueTypes());
            return Optional.empty();
        }
        metrics.recordCacheHit();
        return Optional.of(BrainResult.success(cached.get().toResponse(), cached.get().confidence(), true));
    }

    private BrainReply callWithRetry(BrainQuery query, Deadline deadline) {
        int maxAttempts = Math.max(1, properties.getMaxAttempts());
        TransientNetworkException last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (deadline.expired()) {
                throw new DeadlineExceededException("Deadline reached before attempt " + attempt, last);
            }
            Duration attemptTimeout = deadline.bound(properties.getAttemptTimeoutBase().multipliedBy(attempt));
            // The transport works in whole milliseconds
            if (attemptTimeout.toMillis() < 1) {
                throw new DeadlineExceededException("Less than 1ms left for attempt " + attempt, last);
            }
            try {
                metrics.recordAttempt();
                return transport.query(query, attemptTimeout);
            } catch (TransientNetworkException e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                Duration delay = brainBackoffPolicy.delayAfter(attempt);
                if (delay.compareTo(deadline.remaining()) >= 0) {
                    throw new DeadlineExceededException("No time left to retry after attempt " + attempt, e);
                }
                log.warn("[BrainClient] Attempt {}/{} failed ({}), retrying in {}ms",
                        attempt, maxAttempts, e.getMessage(), delay.toMillis());
                metrics.recordRetry();
                pause(delay);
            }
        }

        if (deadline.expired()) {
            throw new DeadlineExceededException("Deadline reached after " + maxAttempts + " attempts", last);
        }
        throw last;
    }

    private void pause(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeadlineExceededException("Interrupted during retry backoff", e);
        }
    }

    private BrainResult accept(ClassificationRequest request, String query, BrainReply reply, long latencyMs) {
        InferenceMode mode = request.mode();
        ValidationResult validation = validator.validate(reply.payloadFor(mode), mode, request.sourceFacts());
        if (!validation.safe()) {
            return degrade(request, DegradationReason.VALIDATION_FAILED, validation.issues());
        }

        BrainResponse response = new BrainResponse(mode, validation.sanitizedContent(), validation.entries(), false);
        ConfidenceResult confidence = scorer.score(new ConfidenceSignals(reply.confidence(), true, true, null));
        cache.put(mode, query, response, validation, confidence);
        metrics.recordSuccess(mode, latencyMs);
        return BrainResult.success(response, confidence, false);
    }

    private BrainResult degrade(ClassificationRequest request, DegradationReason reason, List<ValidationIssue> issues) {
        metrics.recordDegraded(request.mode(), reason);
        BrainResponse fallback = fallbackResponder.respond(request);
        String category = fallback.primaryCategory();
        Boolean inTaxonomy = category != null ? taxonomy.contains(category) : null;
        ConfidenceResult confidence = scorer.score(new ConfidenceSignals(null, inTaxonomy, false, null));
        return BrainResult.degraded(fallback, confidence, reason, issues);
    }
}
