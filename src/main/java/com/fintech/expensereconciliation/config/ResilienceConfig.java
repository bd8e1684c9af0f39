package com.fintech.expensereconciliation.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;

import java.time.Duration;

/**
 * Configuration for Resilience4j Circuit Breaker.
 * <p>
 * The "idempotency-store" breaker wraps every call to the TTL store. While it is open,
 * store calls fail immediately and the idempotency guard takes its fail-open path.
 * <p>
 * States:
 * - CLOSED: Normal operation, requests pass through
 * - OPEN: Store is failing, requests fail fast
 * - HALF_OPEN: Testing if the store has recovered
 */
@Configuration
public class ResilienceConfig {

    @Value("${idempotency.circuit-breaker.failure-rate-threshold:50}")
    private float failureRateThreshold;

    @Value("${idempotency.circuit-breaker.wait-duration-seconds:30}")
    private long waitDurationSeconds;

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // Number of calls to record before calculating failure rate
                .slidingWindowSize(20)
                .minimumNumberOfCalls(10)
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitDurationSeconds))
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                // Only store outages count, not unreadable records
                .recordExceptions(DataAccessException.class)
                .build();

        return CircuitBreakerRegistry.of(config);
    }
}
