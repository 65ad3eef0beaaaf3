package com.finbrain.infrastructure.ai.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "finbrain.brain.cache.store", havingValue = "memory", matchIfMissing = true)
public class CacheCleanupScheduler {

    private final InMemoryCacheStore store;

    @Scheduled(fixedRateString = "${finbrain.brain.cache.purge-interval:PT5M}")
    public void purgeExpiredEntries() {
        int removed = store.purgeExpired();
        log.debug("Purged {} expired brain cache entries, {} remaining", removed, store.size());
    }
}
