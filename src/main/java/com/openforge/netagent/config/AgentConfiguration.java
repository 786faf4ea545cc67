package com.openforge.netagent.config;

import com.openforge.netagent.llm.LlmProperties;

/**
 * Everything needed to assemble an agent outside Spring.
 */
public record AgentConfiguration(AgentProperties agent, LlmProperties llm) {

    public AgentConfiguration {
        if (agent == null) agent = AgentProperties.defaults();
        if (llm == null || llm.primary() == null) {
            throw new ConfigurationException("agent.llm.primary is not configured");
        }
    }
}
