package com.openforge.netagent.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans:
 *  - tool-query pool          → fan-out of adapter calls, one thread per in-flight target
 *  - Java HttpClient          → the only HTTP engine, for backends and the LLM alike
 *  - Jackson ObjectMapper     → snake_case wire names, Java time, tolerant deserialization
 *
 * Each bean has a static twin used when the agent is assembled without Spring.
 */
@Configuration
public class AppConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService toolQueryExecutor() {
        return defaultExecutor();
    }

    /**
     * 10 s connect timeout; per-request timeouts are set at call site.
     */
    @Bean
    public HttpClient httpClient() {
        return defaultHttpClient();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return defaultObjectMapper();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ── Static factories ─────────────────────────────────────────────────────

    /**
     * Grows with the number of targets in flight so that no target waits for
     * a free thread while its timeout is already running; idle threads are
     * reclaimed after a minute.
     */
    public static ExecutorService defaultExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "tool-query-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(factory);
    }

    public static HttpClient defaultHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper for OpenAI-compatible JSON:
     *  - snake_case property names (tool_calls, finish_reason …)
     *  - ISO-8601 dates, not timestamps
     *  - unknown properties ignored
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
