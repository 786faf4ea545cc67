package com.openforge.netagent.config;

import lombok.Builder;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The single configuration object handed to the registry, planner and loop.
 *
 * Bound by Spring from {@code application.yml} under "agent", or read from a
 * standalone YAML file / the environment by {@link AgentConfigLoader}.
 * Absent values fall back to the defaults below.
 */
@ConfigurationProperties(prefix = "agent")
public record AgentProperties(
        Settings settings,
        Map<String, ToolProperties> tools,
        String patternsFile
) {

    public static final String DEFAULT_PATTERNS_FILE = "classpath:patterns/query-patterns.yml";

    public AgentProperties {
        if (settings == null)     settings     = Settings.builder().build();
        if (patternsFile == null) patternsFile = DEFAULT_PATTERNS_FILE;
        // registration order follows declaration order
        tools = tools == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(tools));
    }

    public static AgentProperties defaults() {
        return new AgentProperties(null, null, null);
    }

    @Builder(toBuilder = true)
    public record Settings(
            Boolean queryAllEnabled,
            Boolean concurrentQueries,
            Boolean aggregateMatches,
            Integer timeoutSeconds,
            Integer contextTimeout,
            Integer cacheDurationMinutes,
            Integer maxRetries,
            Long    retryWaitMillis,
            Integer maxIterations,
            Integer maxHistory,
            Boolean includeToolSource,
            Boolean standardizeOutput
    ) {

        public Settings {
            if (queryAllEnabled == null)      queryAllEnabled      = Boolean.TRUE;
            if (concurrentQueries == null)    concurrentQueries    = Boolean.TRUE;
            if (aggregateMatches == null)     aggregateMatches     = Boolean.FALSE;
            if (timeoutSeconds == null)       timeoutSeconds       = 30;
            if (contextTimeout == null)       contextTimeout       = 300;
            if (cacheDurationMinutes == null) cacheDurationMinutes = 5;
            if (maxRetries == null)           maxRetries           = 3;
            if (retryWaitMillis == null)      retryWaitMillis      = 500L;
            if (maxIterations == null)        maxIterations        = 8;
            if (maxHistory == null)           maxHistory           = 10;
            if (includeToolSource == null)    includeToolSource    = Boolean.TRUE;
            if (standardizeOutput == null)    standardizeOutput    = Boolean.TRUE;

            if (timeoutSeconds <= 0) throw new ConfigurationException("timeout-seconds must be positive");
            if (contextTimeout <= 0) throw new ConfigurationException("context-timeout must be positive");
            if (maxIterations <= 0)  throw new ConfigurationException("max-iterations must be positive");
            if (maxRetries < 1)      maxRetries = 1;
        }

        public Duration timeout() {
            return Duration.ofSeconds(timeoutSeconds);
        }

        public Duration contextTimeoutDuration() {
            return Duration.ofSeconds(contextTimeout);
        }

        public Duration cacheDuration() {
            return Duration.ofMinutes(cacheDurationMinutes);
        }
    }
}
