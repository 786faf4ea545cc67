package com.openforge.netagent.config;

import com.openforge.netagent.adapter.AdapterErrorKind;
import com.openforge.netagent.adapter.AdapterException;
import com.openforge.netagent.llm.LlmClient;
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
 * LLM side: one circuit breaker and one retry per provider, "primaryLlm" and
 * "fallbackLlm"; LlmRouter tries primary first and falls through to fallback.
 *
 * Adapter side: each registered tool gets a retry built from
 * {@link #adapterRetryConfig}, retrying retryable BACKEND_ERROR failures only.
 *
 * The static factories are shared with the non-Spring assembly path
 * ({@code NetworkAgent.fromEnvironment()}).
 */
@Configuration
public class Resilience4jConfig {

    public static final String PRIMARY_LLM  = "primaryLlm";
    public static final String FALLBACK_LLM = "fallbackLlm";

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return llmCircuitBreakerRegistry();
    }

    @Bean
    public CircuitBreaker primaryLlmCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(PRIMARY_LLM);
    }

    @Bean
    public CircuitBreaker fallbackLlmCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(FALLBACK_LLM);
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry() {
        return llmRetryRegistry();
    }

    @Bean
    public Retry primaryLlmRetry(RetryRegistry registry) {
        return registry.retry(PRIMARY_LLM);
    }

    @Bean
    public Retry fallbackLlmRetry(RetryRegistry registry) {
        return registry.retry(FALLBACK_LLM);
    }

    // ── Factories ────────────────────────────────────────────────────────────

    public static CircuitBreakerRegistry llmCircuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 10 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                .slowCallDurationThreshold(Duration.ofSeconds(60))
                .slowCallRateThreshold(80)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .recordExceptions(IOException.class, RuntimeException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker(PRIMARY_LLM);
        registry.circuitBreaker(FALLBACK_LLM);
        return registry;
    }

    public static RetryRegistry llmRetryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofSeconds(1))
                // 429 and transport errors; a 4xx answer will not improve on retry
                .retryExceptions(IOException.class, LlmClient.LlmRateLimitException.class,
                        LlmClient.LlmTransportException.class)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry(PRIMARY_LLM);
        registry.retry(FALLBACK_LLM);
        return registry;
    }

    public static RetryConfig adapterRetryConfig(int maxAttempts, Duration wait) {
        return RetryConfig.custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .waitDuration(wait)
                .retryOnException(e -> e instanceof AdapterException adapterError
                        && adapterError.kind() == AdapterErrorKind.BACKEND_ERROR
                        && adapterError.retryable())
                .build();
    }
}
