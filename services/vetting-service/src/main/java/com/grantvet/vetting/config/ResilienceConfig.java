package com.grantvet.vetting.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Circuit breakers for optional collaborators.
 *
 * Court records are advisory: when the service is unhealthy the breaker opens
 * and vetting proceeds without the court records flag instead of waiting on
 * timeouts. Mandatory collaborators are not wrapped; their failures must reach
 * the caller.
 */
@Configuration
@Slf4j
public class ResilienceConfig {

    public static final String COURT_RECORDS = "courtRecords";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        log.info("Initializing Circuit Breaker Registry");

        CircuitBreakerConfig defaultConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .slowCallRateThreshold(50)
                .slowCallDurationThreshold(Duration.ofSeconds(10))
                .permittedNumberOfCallsInHalfOpenState(3)
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(20)
                .minimumNumberOfCalls(5)
                .waitDurationInOpenState(Duration.ofSeconds(60))
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .build();

        // Court records search is rate limited upstream; back off for longer once it fails
        CircuitBreakerConfig courtRecordsConfig = CircuitBreakerConfig.from(defaultConfig)
                .waitDurationInOpenState(Duration.ofMinutes(5))
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(defaultConfig);
        registry.addConfiguration(COURT_RECORDS, courtRecordsConfig);

        registry.getEventPublisher().onEntryAdded(event -> {
            CircuitBreaker breaker = event.getAddedEntry();
            breaker.getEventPublisher().onStateTransition(transition ->
                    log.warn("Circuit breaker {} transitioned: {}", breaker.getName(), transition.getStateTransition()));
        });
        return registry;
    }

    @Bean
    public CircuitBreaker courtRecordsCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(COURT_RECORDS, COURT_RECORDS);
    }
}
