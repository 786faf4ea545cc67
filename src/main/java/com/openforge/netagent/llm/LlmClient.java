package com.openforge.netagent.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.netagent.llm.model.ChatRequest;
import com.openforge.netagent.llm.model.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Stateless client for one OpenAI-compatible provider.
 *
 * {@link #chat} blocks until the full completion arrives. HTTP 429 raises
 * {@link LlmRateLimitException}, transport trouble {@link LlmTransportException},
 * any other non-2xx answer {@link LlmException}.
 */
@Slf4j
public class LlmClient {

    private final HttpClient                   httpClient;
    private final ObjectMapper                 objectMapper;
    private final LlmProperties.ProviderConfig config;

    public LlmClient(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties.ProviderConfig config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public ChatResponse chat(ChatRequest request) {
        ChatRequest effective = request.model() == null || request.model().isBlank()
                ? request.toBuilder().model(config.model()).build()
                : request;

        String body = serialize(effective);
        log.debug("[LlmClient:{}] → chat POST messages={} body-length={}",
                config.name(), effective.messages().size(), body.length());

        return parse(send(buildHttpRequest(body)));
    }

    public String modelName() {
        return config.model();
    }

    public String providerName() {
        return config.name();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest buildHttpRequest(String body) {
        if (config.baseUrl() == null || config.baseUrl().isBlank()) {
            throw new LlmException("Provider [%s] has no base-url".formatted(config.name()));
        }
        String baseUrl = config.baseUrl().endsWith("/")
                ? config.baseUrl().substring(0, config.baseUrl().length() - 1)
                : config.baseUrl();
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new LlmTransportException("Network error calling provider [%s]: %s"
                    .formatted(config.name(), e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted while calling provider [%s]".formatted(config.name()), e);
        }
    }

    private ChatResponse parse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();
        log.debug("[LlmClient:{}] ← HTTP {} body-length={}", config.name(), status,
                body == null ? 0 : body.length());

        if (status == 429) throw new LlmRateLimitException(
                "Rate-limited by provider [%s]".formatted(config.name()));
        if (status < 200 || status >= 300) throw new LlmException(
                "Provider [%s] returned HTTP %d: %s".formatted(config.name(), status, body));

        try {
            return objectMapper.readValue(body, ChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new LlmException(
                    "Unparseable response from provider [%s]".formatted(config.name()), e);
        }
    }

    private String serialize(ChatRequest request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to serialize chat request", e);
        }
    }

    // ── Exception types ──────────────────────────────────────────────────────

    public static class LlmException extends RuntimeException {
        public LlmException(String message) { super(message); }
        public LlmException(String message, Throwable cause) { super(message, cause); }
    }

    public static class LlmRateLimitException extends LlmException {
        public LlmRateLimitException(String message) { super(message); }
    }

    public static class LlmTransportException extends LlmException {
        public LlmTransportException(String message, Throwable cause) { super(message, cause); }
    }
}
