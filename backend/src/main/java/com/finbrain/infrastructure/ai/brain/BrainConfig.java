package com.finbrain.infrastructure.ai.brain;

import com.finbrain.infrastructure.ai.resilience.BackoffPolicy;
import com.finbrain.infrastructure.ai.resilience.CircuitBreaker;
import com.finbrain.infrastructure.ai.resilience.RequestGate;
import com.finbrain.infrastructure.ai.resilience.Sleeper;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class BrainConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // Retries and per-call timeouts are handled by BrainClient
    @Bean
    public OkHttpClient brainHttpClient(BrainProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(properties.getConnectTimeout())
                .readTimeout(properties.getOverallTimeout())
                .retryOnConnectionFailure(false)
                .build();
    }

    @Bean
    public CircuitBreaker brainCircuitBreaker(BrainProperties properties, Clock clock) {
        BrainProperties.Circuit circuit = properties.getCircuit();
        return new CircuitBreaker("ai-brain", circuit.getFailureThreshold(), circuit.getFailureWindow(),
                circuit.getCooldown(), clock);
    }

    @Bean
    public RequestGate brainRequestGate(BrainProperties properties) {
        return new RequestGate(properties.getGate().getCapacity());
    }

    @Bean
    public BackoffPolicy brainBackoffPolicy(BrainProperties properties) {
        return new BackoffPolicy(properties.getBackoffBase(), properties.getBackoffMax(),
                properties.getBackoffJitter());
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }
}
