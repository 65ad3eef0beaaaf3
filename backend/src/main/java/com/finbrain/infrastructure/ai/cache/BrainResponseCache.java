package com.finbrain.infrastructure.ai.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finbrain.domain.inference.model.BrainResponse;
import com.finbrain.domain.inference.model.ConfidenceResult;
import com.finbrain.domain.inference.model.InferenceMode;
import com.finbrain.domain.inference.model.ValidationResult;
import com.finbrain.infrastructure.ai.brain.BrainProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Response cache in front of the remote AI Brain.
 * <p>
 * Only answers that passed validation are stored, and only for cacheable modes. Store failures are
 * logged and behave as a miss; they never fail the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BrainResponseCache {

    public record CacheStats(long hits, long misses, long writes, long errors) {}

    private final CacheStore store;
    private final CacheKeyBuilder keyBuilder;
    private final ObjectMapper objectMapper;
    private final BrainProperties properties;
    private final Clock clock;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong writes = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    public Optional<CachedBrainResponse> get(InferenceMode mode, String query) {
        if (!usable(mode)) {
            return Optional.empty();
        }
        String key = storeKey(mode, query);
        try {
            Optional<String> raw = store.get(key);
            if (raw.isEmpty()) {
                misses.incrementAndGet();
                return Optional.empty();
            }
            CachedBrainResponse cached = objectMapper.readValue(raw.get(), CachedBrainResponse.class);
            hits.incrementAndGet();
            log.debug("[BrainResponseCache] Hit for {} query", mode);
            return Optional.of(cached);
        } catch (JsonProcessingException e) {
            errors.incrementAndGet();
            misses.incrementAndGet();
            log.warn("[BrainResponseCache] Dropping unreadable entry: {}", e.getOriginalMessage());
            safeDelete(key);
            return Optional.empty();
        } catch (RuntimeException e) {
            errors.incrementAndGet();
            misses.incrementAndGet();
            log.warn("[BrainResponseCache] Store read failed, treating as miss: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public boolean put(InferenceMode mode, String query, BrainResponse response,
                       ValidationResult validation, ConfidenceResult confidence) {
        return put(mode, query, response, validation, confidence, properties.getCache().getTtl());
    }

    /**
     * @return true if the entry was written
     */
    public boolean put(InferenceMode mode, String query, BrainResponse response,
                       ValidationResult validation, ConfidenceResult confidence, Duration ttl) {
        if (!usable(mode) || response == null || response.fallback() || validation == null || !validation.safe()) {
            return false;
        }
        CachedBrainResponse value = new CachedBrainResponse(mode, response.content(), response.entries(),
                confidence, clock.instant());
        try {
            store.set(storeKey(mode, query), objectMapper.writeValueAsString(value), ttl);
            writes.incrementAndGet();
            return true;
        } catch (JsonProcessingException e) {
            errors.incrementAndGet();
            log.warn("[BrainResponseCache] Could not serialize {} response: {}", mode, e.getOriginalMessage());
            return false;
        } catch (RuntimeException e) {
            errors.incrementAndGet();
            log.warn("[BrainResponseCache] Store write failed: {}", e.getMessage());
            return false;
        }
    }

    public void invalidate(InferenceMode mode, String query) {
        safeDelete(storeKey(mode, query));
    }

    public CacheStats stats() {
        return new CacheStats(hits.get(), misses.get(), writes.get(), errors.get());
    }

    private boolean usable(InferenceMode mode) {
        return properties.getCache().isEnabled() && mode != null && mode.isCacheable();
    }

    private String storeKey(InferenceMode mode, String query) {
        return properties.getCache().getKeyPrefix() + keyBuilder.buildKey(mode, query);
    }

    private void safeDelete(String key) {
        try {
            store.delete(key);
        } catch (RuntimeException e) {
            errors.incrementAndGet();
            log.warn("[BrainResponseCache] Store delete failed: {}", e.getMessage());
        }
    }
}
