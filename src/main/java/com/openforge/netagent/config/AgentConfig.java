package com.openforge.netagent.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.netagent.agent.NetworkAgent;
import com.openforge.netagent.llm.LlmProperties;
import com.openforge.netagent.llm.ReasoningModel;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.concurrent.ExecutorService;

/**
 * Wires the agent from {@code agent.*} in application.yml. The executor is
 * owned by the Spring context, not by the agent.
 */
@Configuration
@EnableConfigurationProperties(AgentProperties.class)
public class AgentConfig {

    @Bean
    public NetworkAgent networkAgent(AgentProperties agentProperties,
                                     LlmProperties llmProperties,
                                     ReasoningModel reasoningModel,
                                     HttpClient httpClient,
                                     ObjectMapper objectMapper,
                                     ExecutorService toolQueryExecutor,
                                     Clock clock) {
        return NetworkAgent.create(agentProperties, llmProperties, reasoningModel,
                httpClient, objectMapper, toolQueryExecutor, clock, false);
    }
}
