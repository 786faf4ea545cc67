package com.openforge.netagent.llm.model;

import java.util.List;

/**
 * Non-streaming {@code /chat/completions} response.
 */
public record ChatResponse(
        String id,
        String model,
        List<Choice> choices,
        Usage usage
) {

    /** Wraps a single assistant message, as a provider would. */
    public static ChatResponse of(Message message) {
        return new ChatResponse(null, null, List.of(new Choice(0, message, null)), null);
    }

    public Message firstMessage() {
        if (choices == null || choices.isEmpty() || choices.get(0).message() == null) {
            throw new IllegalStateException("LLM response %s carried no message".formatted(id));
        }
        return choices.get(0).message();
    }

    public boolean hasToolCalls() {
        if (choices == null || choices.isEmpty()) return false;
        Message message = choices.get(0).message();
        return message != null && message.toolCalls() != null && !message.toolCalls().isEmpty();
    }

    public record Choice(int index, Message message, String finishReason) {}

    public record Usage(int promptTokens, int completionTokens, int totalTokens) {}
}
