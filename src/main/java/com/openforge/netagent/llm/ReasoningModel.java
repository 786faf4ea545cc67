package com.openforge.netagent.llm;

import com.openforge.netagent.llm.model.ChatRequest;
import com.openforge.netagent.llm.model.ChatResponse;

/**
 * The reasoning step of the agent loop: one chat completion.
 *
 * @throws LlmClient.LlmException when no provider could answer
 */
@FunctionalInterface
public interface ReasoningModel {

    ChatResponse chat(ChatRequest request);
}
