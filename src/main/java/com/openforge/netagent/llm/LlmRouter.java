package com.openforge.netagent.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.netagent.config.ConfigurationException;
import com.openforge.netagent.config.Resilience4jConfig;
import com.openforge.netagent.llm.model.ChatRequest;
import com.openforge.netagent.llm.model.ChatResponse;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.function.Supplier;

/**
 * Routes reasoning calls to the primary provider and, if that fails, to the
 * optional fallback provider.
 *
 *   chat(request)
 *     └─ primary circuit breaker + retry → primary client
 *          ↓ any failure, including an open circuit
 *     └─ fallback circuit breaker + retry → fallback client
 *
 * Without a configured fallback the primary failure is final.
 */
@Slf4j
@Component
@EnableConfigurationProperties(LlmProperties.class)
public class LlmRouter implements ReasoningModel {

    private final LlmClient      primaryClient;
    private final LlmClient      fallbackClient;
    private final CircuitBreaker primaryCb;
    private final CircuitBreaker fallbackCb;
    private final Retry          primaryRetry;
    private final Retry          fallbackRetry;

    public LlmRouter(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties,
                     CircuitBreaker primaryLlmCircuitBreaker,
                     CircuitBreaker fallbackLlmCircuitBreaker,
                     Retry primaryLlmRetry,
                     Retry fallbackLlmRetry) {
        if (properties.primary() == null) {
            throw new ConfigurationException("agent.llm.primary must be configured");
        }
        this.primaryClient  = new LlmClient(httpClient, objectMapper, properties.primary());
        this.fallbackClient = properties.hasFallback()
                ? new LlmClient(httpClient, objectMapper, properties.fallback())
                : null;
        this.primaryCb      = primaryLlmCircuitBreaker;
        this.fallbackCb     = fallbackLlmCircuitBreaker;
        this.primaryRetry   = primaryLlmRetry;
        this.fallbackRetry  = fallbackLlmRetry;
    }

    /** Assembly outside Spring, with the same resilience settings as the beans. */
    public static LlmRouter create(HttpClient httpClient, ObjectMapper objectMapper, LlmProperties properties) {
        CircuitBreakerRegistry breakers = Resilience4jConfig.llmCircuitBreakerRegistry();
        RetryRegistry retries = Resilience4jConfig.llmRetryRegistry();
        return new LlmRouter(httpClient, objectMapper, properties,
                breakers.circuitBreaker(Resilience4jConfig.PRIMARY_LLM),
                breakers.circuitBreaker(Resilience4jConfig.FALLBACK_LLM),
                retries.retry(Resilience4jConfig.PRIMARY_LLM),
                retries.retry(Resilience4jConfig.FALLBACK_LLM));
    }

    // ── Public API ───────────────────────────────────────────────────────────

    @Override
    public ChatResponse chat(ChatRequest request) {
        try {
            ChatRequest primaryRequest = withModel(request, primaryClient.modelName());
            return executeWithResilience(primaryCb, primaryRetry,
                    () -> primaryClient.chat(primaryRequest), primaryClient.providerName());
        } catch (LlmClient.LlmException primaryFailure) {
            if (fallbackClient == null) throw primaryFailure;

            log.warn("[LlmRouter] Primary provider failed ({}), engaging fallback. Cause: {}",
                    primaryFailure.getClass().getSimpleName(), primaryFailure.getMessage());
            ChatRequest fallbackRequest = withModel(request, fallbackClient.modelName());
            return executeWithResilience(fallbackCb, fallbackRetry,
                    () -> fallbackClient.chat(fallbackRequest), fallbackClient.providerName());
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private ChatResponse executeWithResilience(CircuitBreaker cb,
                                               Retry retry,
                                               Supplier<ChatResponse> call,
                                               String label) {
        Supplier<ChatResponse> decorated =
                CircuitBreaker.decorateSupplier(cb, Retry.decorateSupplier(retry, call));
        try {
            return decorated.get();
        } catch (RuntimeException e) {
            throw new LlmClient.LlmException(
                    "[LlmRouter] provider %s ultimately failed: %s".formatted(label, e.getMessage()), e);
        }
    }

    private static ChatRequest withModel(ChatRequest original, String modelName) {
        return original.toBuilder().model(modelName).build();
    }
}
