package com.finbrain.infrastructure.ai.cache;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared store on Redis, so replicas share cached answers. Expiry is delegated to Redis TTLs.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "finbrain.brain.cache.store", havingValue = "redis")
public class RedisCacheStore implements CacheStore {

    private final StringRedisTemplate redisTemplate;

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        redisTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(key);
    }
}
