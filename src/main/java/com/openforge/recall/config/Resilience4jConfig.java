package com.openforge.recall.config;

import com.openforge.recall.memory.EmbeddingClient;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;

/**
 * Programmatic Resilience4j wiring.
 *
 * Circuit breakers:
 *   • one per retrieval source, named after the source ("semantic-canon",
 *     "lexical-canon", "podcast" …), created on first use by HybridSearchEngine
 *   • "embedding" around the query embedding call (see QueryEmbedder)
 *
 * An open breaker makes its source fail fast, so a dead backend stops costing
 * the per-source timeout on every turn.
 */
@Configuration
public class Resilience4jConfig {

    public static final String EMBEDDING = "embedding";

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 20 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(20)
                .minimumNumberOfCalls(10)
                .failureRateThreshold(50)
                // a source slower than its retrieval budget counts against it
                .slowCallDurationThreshold(Duration.ofMillis(500))
                .slowCallRateThreshold(80)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(15))
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker(EMBEDDING);
        return registry;
    }

    @Bean
    public CircuitBreaker embeddingCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(EMBEDDING);
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    /**
     * One quick retry for the embedding call; anything longer would eat the
     * semantic sources' time budget.  Permanent failures (4xx, wrong
     * dimensions) are not retried.
     */
    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(50))
                .retryOnException(e -> e instanceof IOException
                        || e instanceof EmbeddingClient.EmbeddingException ee && ee.isRetryable())
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry(EMBEDDING);
        return registry;
    }

    @Bean
    public Retry embeddingRetry(RetryRegistry registry) {
        return registry.retry(EMBEDDING);
    }
}
