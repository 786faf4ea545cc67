package com.openforge.netagent.llm;

import com.openforge.netagent.config.AppConfig;
import com.openforge.netagent.llm.model.ChatRequest;
import com.openforge.netagent.llm.model.ChatResponse;
import com.openforge.netagent.llm.model.Message;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmRouterTest {

    private static final String COMPLETION = """
            {"id": "cmpl-1", "model": "backup-model",
             "choices": [{"index": 0, "message": {"role": "assistant", "content": "sw1 is down"},
                          "finish_reason": "stop"}]}
            """;

    private static final LlmProperties.ProviderConfig PRIMARY =
            new LlmProperties.ProviderConfig("openai", "https://primary.example.com/v1", "sk-primary", "gpt-4o", 5);
    private static final LlmProperties.ProviderConfig FALLBACK =
            new LlmProperties.ProviderConfig("backup", "https://backup.example.com/v1/", "sk-backup", "backup-model", 5);

    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(int status, String body) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        return response;
    }

    private static HttpRequest forHost(String host) {
        return argThat(request -> request != null && host.equals(request.uri().getHost()));
    }

    private LlmRouter router(LlmProperties.ProviderConfig fallback) {
        RetryConfig quickRetry = RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(LlmClient.LlmRateLimitException.class, LlmClient.LlmTransportException.class)
                .build();
        return new LlmRouter(httpClient, AppConfig.defaultObjectMapper(),
                new LlmProperties(PRIMARY, fallback, null, null),
                CircuitBreaker.ofDefaults("primary"), CircuitBreaker.ofDefaults("fallback"),
                Retry.of("primary", quickRetry), Retry.of("fallback", quickRetry));
    }

    private static ChatRequest request() {
        return ChatRequest.reasoning(List.of(Message.user("is sw1 up?")), List.of(), 0.0, 256);
    }

    @Test
    @DisplayName("A failing primary provider falls through to the fallback with the fallback's model")
    void fallsBackToSecondProvider() throws Exception {
        // Given
        HttpResponse<String> serverError = response(500, "{\"error\": \"boom\"}");
        HttpResponse<String> ok = response(200, COMPLETION);
        doReturn(serverError).when(httpClient).send(forHost("primary.example.com"), any());
        doReturn(ok).when(httpClient).send(forHost("backup.example.com"), any());

        // When
        ChatResponse response = router(FALLBACK).chat(request());

        // Then
        assertThat(response.firstMessage().content()).isEqualTo("sw1 is down");
        ArgumentCaptor<HttpRequest> sent = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient, times(2)).send(sent.capture(), any());
        assertThat(sent.getAllValues().get(1).uri().toString())
                .isEqualTo("https://backup.example.com/v1/chat/completions");
        assertThat(sent.getAllValues().get(1).headers().firstValue("Authorization")).contains("Bearer sk-backup");
    }

    @Test
    @DisplayName("Rate limiting is retried before giving up")
    void retriesRateLimit() throws Exception {
        // Given
        HttpResponse<String> limited = response(429, "slow down");
        doReturn(limited).when(httpClient).send(any(HttpRequest.class), any());

        // When / Then
        assertThatThrownBy(() -> router(null).chat(request()))
                .isInstanceOf(LlmClient.LlmException.class)
                .hasMessageContaining("openai");
        verify(httpClient, times(2)).send(any(HttpRequest.class), any());
    }

    @Test
    @DisplayName("A transport error without a fallback surfaces as LlmException")
    void transportErrorWithoutFallback() throws Exception {
        // Given
        doThrow(new IOException("connection refused")).when(httpClient).send(any(HttpRequest.class), any());

        // When / Then
        assertThatThrownBy(() -> router(null).chat(request()))
                .isInstanceOf(LlmClient.LlmException.class)
                .hasMessageContaining("connection refused");
    }
}
