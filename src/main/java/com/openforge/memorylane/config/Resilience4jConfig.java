package com.openforge.memorylane.config;

import com.openforge.memorylane.extraction.ExtractionException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;

/**
 * Programmatic Resilience4j wiring.
 *
 * One named breaker per extraction transport:
 *   • "cliExtraction" : the local assistant CLI
 *   • "apiExtraction" : the keyed messages API
 *
 * No Retry registry: a chunk gets at most one attempt per
 * transport, and the CLI → API fallback in MemoryExtractionClient is the only
 * second chance.
 */
@Configuration
public class Resilience4jConfig {

    public static final String CLI_BREAKER = "cliExtraction";
    public static final String API_BREAKER = "apiExtraction";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 10 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .failureRateThreshold(50)
                // a chunk close to the provider timeout is a slow call
                .slowCallDurationThreshold(Duration.ofSeconds(90))
                .slowCallRateThreshold(80)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .recordExceptions(IOException.class, ExtractionException.ProviderFailureException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker(CLI_BREAKER);
        registry.circuitBreaker(API_BREAKER);
        return registry;
    }

    @Bean
    public CircuitBreaker cliExtractionCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(CLI_BREAKER);
    }

    @Bean
    public CircuitBreaker apiExtractionCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(API_BREAKER);
    }
}
