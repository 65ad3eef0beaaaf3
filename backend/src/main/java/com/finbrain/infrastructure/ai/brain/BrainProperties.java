package com.finbrain.infrastructure.ai.brain;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Settings for calls to the remote AI Brain: endpoint, retry and timeout policy, circuit breaker,
 * admission gate and response cache.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "finbrain.brain")
public class BrainProperties {

    private String baseUrl = "http://localhost:8080";
    private Duration connectTimeout = Duration.ofSeconds(2);

    /** Overall budget of one classify call when the caller supplies no deadline. */
    private Duration overallTimeout = Duration.ofSeconds(15);

    /** Attempt N gets {@code attemptTimeoutBase * N}: 2s, 4s, 6s by default. */
    private Duration attemptTimeoutBase = Duration.ofSeconds(2);

    private int maxAttempts = 3;
    private Duration backoffBase = Duration.ofMillis(500);
    private Duration backoffMax = Duration.ofSeconds(4);

    /** Fraction of each backoff delay that is randomized, in [0,1]. */
    private double backoffJitter = 0.5;

    private Circuit circuit = new Circuit();
    private Gate gate = new Gate();
    private Cache cache = new Cache();

    @Getter
    @Setter
    public static class Circuit {
        private int failureThreshold = 5;
        private Duration failureWindow = Duration.ofSeconds(60);
        private Duration cooldown = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Gate {
        private int capacity = 3;
        private Duration acquireTimeout = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Cache {
        private boolean enabled = true;
        private Duration ttl = Duration.ofHours(1);
        private String keyPrefix = "finbrain:brain:";

        /** {@code memory} (default) or {@code redis}. */
        private String store = "memory";
        private Duration purgeInterval = Duration.ofMinutes(5);
    }
}
