package com.finbrain.infrastructure.ai.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value store with per-entry expiry backing the response cache. Implementations may throw on
 * connectivity problems; callers treat that as a miss.
 */
public interface CacheStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    void delete(String key);
}
