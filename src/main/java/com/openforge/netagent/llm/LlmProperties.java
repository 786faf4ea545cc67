package com.openforge.netagent.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * OpenAI-compatible provider settings under "agent.llm":
 *
 * agent:
 *   llm:
 *     temperature: 0.0
 *     primary:
 *       name: openai
 *       base-url: https://api.openai.com/v1
 *       api-key: ${LLM_API_KEY}
 *       model: gpt-4o
 *       timeout-seconds: 120
 *     fallback:            # optional
 *       name: deepseek
 *       base-url: https://api.deepseek.com/v1
 *       api-key: ${FALLBACK_LLM_API_KEY}
 *       model: deepseek-chat
 */
@ConfigurationProperties(prefix = "agent.llm")
public record LlmProperties(
        ProviderConfig primary,
        ProviderConfig fallback,
        Double temperature,
        Integer maxTokens
) {

    public LlmProperties {
        if (temperature == null) temperature = 0.0;
        if (maxTokens == null)   maxTokens   = 2048;
    }

    public boolean hasFallback() {
        return fallback != null && fallback.baseUrl() != null && !fallback.baseUrl().isBlank();
    }

    public record ProviderConfig(
            String name,
            String baseUrl,
            String apiKey,
            String model,
            Integer timeoutSeconds
    ) {

        public ProviderConfig {
            if (name == null)           name           = "primary";
            if (timeoutSeconds == null) timeoutSeconds = 120;
        }
    }
}
