package com.bank.tlm.application.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resiliency configuration.
 * The ledger write path has no retries; only outbound notifications sit behind a breaker.
 */
@Configuration
public class ResiliencyConfig {
    
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.ofDefaults();
    }
    
    /**
     * Circuit breaker for lifecycle notification publishing
     */
    @Bean("notificationCircuitBreaker")
    public CircuitBreaker notificationCircuitBreaker(
            CircuitBreakerRegistry registry,
            @Value("${app.resilience.notification.wait-in-open-state:30s}") Duration waitInOpenState) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(50.0f) // Open after 50% failures
                .waitDurationInOpenState(waitInOpenState)
                .slidingWindowSize(20)
                .minimumNumberOfCalls(10)
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .recordExceptions(Exception.class)
                .build();
        
        return registry.circuitBreaker("notification", config);
    }
}
