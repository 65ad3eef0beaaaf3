package com.finbrain.infrastructure.ai.brain;

import com.finbrain.domain.inference.model.CircuitPhase;
import com.finbrain.domain.inference.model.CircuitSnapshot;
import com.finbrain.infrastructure.ai.resilience.CircuitBreaker;
import com.finbrain.infrastructure.ai.resilience.RequestGate;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Reports remote AI Brain liveness together with breaker and gate state under {@code /actuator/health}.
 * An open circuit is reported without probing the remote service.
 */
@Component("brain")
@RequiredArgsConstructor
public class BrainHealthIndicator implements HealthIndicator {

    private static final Duration HEALTH_CHECK_TIMEOUT = Duration.ofSeconds(2);

    private final BrainTransport transport;
    private final CircuitBreaker brainCircuitBreaker;
    private final RequestGate brainRequestGate;

    @Override
    public Health health() {
        CircuitSnapshot circuit = brainCircuitBreaker.snapshot();
        Health.Builder builder;
        if (circuit.phase() == CircuitPhase.OPEN) {
            builder = Health.outOfService();
        } else if (transport.isHealthy(HEALTH_CHECK_TIMEOUT)) {
            builder = Health.up();
        } else {
            builder = Health.down();
        }
        return builder
                .withDetail("circuit", circuit.phase())
                .withDetail("consecutiveFailures", circuit.consecutiveFailures())
                .withDetail("gate", brainRequestGate.stats())
                .build();
    }
}
