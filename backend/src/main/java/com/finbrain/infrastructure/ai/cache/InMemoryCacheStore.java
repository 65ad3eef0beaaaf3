package com.finbrain.infrastructure.ai.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Expired entries are hidden on read and removed by {@link #purgeExpired()}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "finbrain.brain.cache.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryCacheStore implements CacheStore {

    private record Entry(String value, Instant expiresAt) {}

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCacheStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    /**
     * @return number of entries removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(e -> !now.isBefore(e.getValue().expiresAt()));
        return before - entries.size();
    }

    public int size() {
        return entries.size();
    }
}
