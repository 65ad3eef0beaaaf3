package com.finbrain.infrastructure.ai.brain;

import com.finbrain.domain.inference.model.DegradationReason;
import com.finbrain.domain.inference.model.InferenceMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Component
public class BrainMetricsTracker {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong remoteAttempts = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong successes = new AtomicLong();
    private final AtomicLong totalLatencyMs = new AtomicLong();
    private final Map<DegradationReason, AtomicLong> degraded = new EnumMap<>(DegradationReason.class);

    public BrainMetricsTracker() {
        for (DegradationReason reason : DegradationReason.values()) {
            degraded.put(reason, new AtomicLong());
        }
    }

    public void recordRequest() {
        totalRequests.incrementAndGet();
    }

    public void recordCacheHit() {
        cacheHits.incrementAndGet();
    }

    public void recordAttempt() {
        remoteAttempts.incrementAndGet();
    }

    public void recordRetry() {
        retries.incrementAndGet();
    }

    public void recordSuccess(InferenceMode mode, long latencyMs) {
        successes.incrementAndGet();
        totalLatencyMs.addAndGet(latencyMs);
        log.info("Brain metrics - {} success in {}ms, cumulative: requests={}, successRate={}%, cacheHitRate={}%",
                mode, latencyMs, totalRequests.get(),
                String.format("%.1f", getSuccessRate()), String.format("%.1f", getCacheHitRate()));
    }

    public void recordDegraded(InferenceMode mode, DegradationReason reason) {
        long count = degraded.get(reason).incrementAndGet();
        log.warn("Brain metrics - {} degraded ({}), {} so far for this reason", mode, reason, count);
    }

    public double getCacheHitRate() {
        long total = totalRequests.get();
        return total > 0 ? (double) cacheHits.get() / total * 100 : 0;
    }

    public double getSuccessRate() {
        long total = totalRequests.get() - cacheHits.get();
        return total > 0 ? (double) successes.get() / total * 100 : 0;
    }

    public double getAverageLatencyMs() {
        long count = successes.get();
        return count > 0 ? (double) totalLatencyMs.get() / count : 0;
    }

    public Map<String, Object> snapshot() {
        Map<String, Long> degradedCounts = new LinkedHashMap<>();
        degraded.forEach((reason, counter) -> degradedCounts.put(reason.name(), counter.get()));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("totalRequests", totalRequests.get());
        result.put("cacheHits", cacheHits.get());
        result.put("remoteAttempts", remoteAttempts.get());
        result.put("retries", retries.get());
        result.put("successes", successes.get());
        result.put("averageLatencyMs", getAverageLatencyMs());
        result.put("degraded", degradedCounts);
        return result;
    }
}
