package com.openforge.netagent.support;

import com.openforge.netagent.llm.ReasoningModel;
import com.openforge.netagent.llm.model.ChatRequest;
import com.openforge.netagent.llm.model.ChatResponse;
import com.openforge.netagent.llm.model.Message;
import com.openforge.netagent.llm.model.ToolCall;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

/**
 * Reasoning model that replays queued replies. When the queue is empty the
 * fallback reply is used.
 */
public class ScriptedReasoningModel implements ReasoningModel {

    private final Deque<Function<ChatRequest, ChatResponse>> script = new ArrayDeque<>();
    private final List<ChatRequest> requests = new ArrayList<>();
    private Function<ChatRequest, ChatResponse> fallback = request -> ChatResponse.of(Message.assistantText("done"));

    public ScriptedReasoningModel answer(String text) {
        script.add(request -> ChatResponse.of(Message.assistantText(text)));
        return this;
    }

    public ScriptedReasoningModel callTool(String id, String argumentsJson) {
        script.add(request -> ChatResponse.of(Message.assistantToolCalls(
                List.of(ToolCall.of(id, "query_network_tool", argumentsJson)))));
        return this;
    }

    public ScriptedReasoningModel reply(Function<ChatRequest, ChatResponse> reply) {
        script.add(reply);
        return this;
    }

    public ScriptedReasoningModel otherwise(Function<ChatRequest, ChatResponse> reply) {
        this.fallback = reply;
        return this;
    }

    public List<ChatRequest> requests() {
        return requests;
    }

    public ChatRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    @Override
    public synchronized ChatResponse chat(ChatRequest request) {
        requests.add(request);
        Function<ChatRequest, ChatResponse> next = script.isEmpty() ? fallback : script.poll();
        return next.apply(request);
    }
}
