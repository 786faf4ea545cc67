package com.openforge.netagent.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.netagent.adapter.Operation;
import com.openforge.netagent.agent.event.AgentEvent;
import com.openforge.netagent.config.AgentProperties;
import com.openforge.netagent.context.ContextManager;
import com.openforge.netagent.context.EntityExtractor;
import com.openforge.netagent.llm.LlmClient;
import com.openforge.netagent.llm.LlmProperties;
import com.openforge.netagent.llm.ReasoningModel;
import com.openforge.netagent.llm.model.ChatRequest;
import com.openforge.netagent.llm.model.ChatResponse;
import com.openforge.netagent.llm.model.Message;
import com.openforge.netagent.llm.model.Tool;
import com.openforge.netagent.llm.model.ToolCall;
import com.openforge.netagent.mapping.DataMapper;
import com.openforge.netagent.mapping.NormalizedRecord;
import com.openforge.netagent.planner.PlanResult;
import com.openforge.netagent.planner.PlannedOperation;
import com.openforge.netagent.planner.PlanningAmbiguousException;
import com.openforge.netagent.planner.SemanticQueryPlanner;
import com.openforge.netagent.registry.ToolInvocationResult;
import com.openforge.netagent.registry.ToolRegistry;
import com.openforge.netagent.registry.ToolSpec;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Interleaves LLM reasoning with tool queries until an answer is reached.
 *
 * Loop shape:
 *   PLAN: the planner's immediate operations seed the first ACTING round
 *   ACTING: dispatch requested operations through the registry
 *   OBSERVING: normalize results, append them to the transcript, update context;
 *           after the seed round, plan follow-ups run once if a primary succeeded
 *   REASONING: the LLM either requests more data (→ ACTING) or answers (→ DONE)
 *
 * Termination:
 *   - more than max-iterations reasoning rounds      → FAILED / REASONING_EXHAUSTED
 *   - every target failed in two consecutive rounds  → FAILED / ADAPTER_FAILURE
 *   - no LLM provider reachable                      → FAILED / LLM_UNAVAILABLE
 *   - no plan possible                               → FAILED / PLANNING_AMBIGUOUS
 */
@Slf4j
public class ReActLoop {

    public static final String QUERY_TOOL = "query_network_tool";

    static final String ALL_TOOLS = "all";

    private static final int MAX_RECORDS_PER_OBSERVATION = 100;
    private static final int ALL_FAILED_ROUNDS_LIMIT     = 2;

    private static final String SYSTEM_PROMPT =
            """
            You are a network operations assistant. You answer questions about network
            infrastructure using data from the network management tools listed below.

            Tool observations arrive as JSON. Call "%s" when you need more data.
            When the observations answer the question, reply with the answer only,
            without calling a tool. If a data source failed, say which part of the
            answer may be incomplete.

            Available tools: %s
            """;

    private static final String NUDGE =
            "Please answer the original question now from the observations above, "
            + "or call the tool if you still need data.";

    private final SemanticQueryPlanner     planner;
    private final ToolRegistry             registry;
    private final DataMapper               dataMapper;
    private final ReasoningModel           model;
    private final ObjectMapper             objectMapper;
    private final AgentProperties.Settings settings;
    private final LlmProperties            llmProperties;

    public ReActLoop(SemanticQueryPlanner planner,
                     ToolRegistry registry,
                     DataMapper dataMapper,
                     ReasoningModel model,
                     ObjectMapper objectMapper,
                     AgentProperties.Settings settings,
                     LlmProperties llmProperties) {
        this.planner       = planner;
        this.registry      = registry;
        this.dataMapper    = dataMapper;
        this.model         = model;
        this.objectMapper  = objectMapper;
        this.settings      = settings;
        this.llmProperties = llmProperties;
    }

    // ── Entry point ──────────────────────────────────────────────────────────

    public QueryOutcome run(String conversationId, String query, ContextManager context) {
        Run run = new Run(conversationId, query);
        log.info("[Agent:{}] Query: {}", conversationId, query);

        PlanResult plan;
        try {
            plan = planner.plan(query);
        } catch (PlanningAmbiguousException e) {
            return run.fail(FailureKind.PLANNING_AMBIGUOUS, e.getMessage());
        }

        run.implicitFilters = context.resolveImplicit(plan.operationQuery(), plan.weakMatch());
        List<Action> seed = new ArrayList<>();
        for (PlannedOperation planned : plan.immediate()) {
            seed.add(toAction(planned.withDefaultFilters(run.implicitFilters))
                    .withCallId("plan-" + (seed.size() + 1)));
        }
        run.events.add(AgentEvent.planReady(conversationId, seed.stream().map(Action::describe).toList()));

        run.messages.add(Message.system(systemPrompt(context)));
        run.messages.add(Message.user(query));

        LoopState state = seed.isEmpty() ? LoopState.REASONING : LoopState.ACTING;
        List<Action> pending = seed;
        if (!seed.isEmpty()) {
            run.messages.add(Message.assistantToolCalls(seed.stream().map(this::toToolCall).toList()));
        }
        boolean seedRound     = !seed.isEmpty();
        boolean primaryRound  = true;
        List<ActionResult> round = List.of();

        while (true) {
            switch (state) {
                case ACTING -> {
                    round = act(run, pending);
                    state = LoopState.OBSERVING;
                }
                case OBSERVING -> {
                    observe(run, round, context, primaryRound);
                    if (run.consecutiveAllFailed >= ALL_FAILED_ROUNDS_LIMIT) {
                        return run.fail(FailureKind.ADAPTER_FAILURE,
                                "All tools failed twice in a row; last error: " + run.lastError);
                    }
                    if (seedRound && !plan.followUps().isEmpty() && anySucceeded(round)) {
                        pending = followUps(plan, round);
                        run.messages.add(Message.assistantToolCalls(pending.stream().map(this::toToolCall).toList()));
                        seedRound     = false;
                        primaryRound  = false;
                        state = LoopState.ACTING;
                    } else {
                        seedRound     = false;
                        primaryRound  = true;
                        state = LoopState.REASONING;
                    }
                }
                case REASONING -> {
                    if (run.iteration >= settings.maxIterations()) {
                        return run.fail(FailureKind.REASONING_EXHAUSTED,
                                "No final answer after %d reasoning rounds".formatted(settings.maxIterations()));
                    }
                    run.iteration++;
                    run.events.add(AgentEvent.iterationStart(conversationId, run.iteration));
                    log.debug("[Agent:{}] Iteration {}", conversationId, run.iteration);

                    ChatResponse response;
                    try {
                        response = model.chat(ChatRequest.reasoning(run.messages, List.of(queryTool()),
                                llmProperties.temperature(), llmProperties.maxTokens()));
                    } catch (LlmClient.LlmException e) {
                        log.error("[Agent:{}] Reasoning model unavailable: {}", conversationId, e.getMessage());
                        return run.fail(FailureKind.LLM_UNAVAILABLE, e.getMessage());
                    }

                    if (response.hasToolCalls()) {
                        List<ToolCall> calls = withIds(response.firstMessage().toolCalls(), run.iteration);
                        run.messages.add(Message.assistantToolCalls(calls));
                        pending = calls.stream().map(this::parseToolCall).toList();
                        state = LoopState.ACTING;
                    } else {
                        String content = response.firstMessage().content();
                        if (content == null || content.isBlank()) {
                            log.debug("[Agent:{}] Empty answer in iteration {}, nudging", conversationId, run.iteration);
                            run.messages.add(Message.user(NUDGE));
                        } else {
                            return run.done(content.strip());
                        }
                    }
                }
                default -> throw new IllegalStateException("Unexpected loop state " + state);
            }
        }
    }

    // ── ACTING ───────────────────────────────────────────────────────────────

    /**
     * Dispatches the round. Actions sharing operation and filters go out as
     * one dispatch so their tools are queried concurrently.
     */
    private List<ActionResult> act(Run run, List<Action> actions) {
        Map<DispatchKey, List<Action>> groups = new LinkedHashMap<>();
        for (Action action : actions) {
            if (action.error() != null) continue;
            run.events.add(AgentEvent.toolCall(run.conversationId, action.toolArgument(),
                    action.operation().wireName(), action.filters(), run.iteration));
            groups.computeIfAbsent(new DispatchKey(action.operation(), action.filters()), k -> new ArrayList<>())
                  .add(action);
        }

        Map<Action, List<ToolInvocationResult>> byAction = new IdentityHashMap<>();
        groups.forEach((key, group) -> {
            List<ToolSpec> targets = new ArrayList<>();
            group.forEach(action -> targets.addAll(action.targets()));
            List<ToolInvocationResult> results = registry.dispatch(targets, key.operation(), key.filters());

            int offset = 0;
            for (Action action : group) {
                byAction.put(action, results.subList(offset, offset + action.targets().size()));
                offset += action.targets().size();
            }
        });

        List<ActionResult> round = new ArrayList<>();
        for (Action action : actions) {
            List<ToolInvocationResult> results = byAction.getOrDefault(action, List.of()).stream()
                    .map(this::normalize)
                    .toList();
            round.add(new ActionResult(action, results));
        }
        return round;
    }

    private ToolInvocationResult normalize(ToolInvocationResult result) {
        if (!result.success()) return result;
        ToolSpec spec = registry.find(result.toolName()).orElse(null);
        List<NormalizedRecord> records = dataMapper.normalize(result.toolName(), result.operation().entity(),
                spec == null ? null : spec.mappingRules(), result.raw());
        return result.withRecords(records);
    }

    // ── OBSERVING ────────────────────────────────────────────────────────────

    /**
     * Follow-up rounds neither count toward the all-failed limit nor replace
     * the entities the primary round resolved.
     */
    private void observe(Run run, List<ActionResult> round, ContextManager context, boolean primaryRound) {
        List<String> answeredBy = new ArrayList<>();
        Map<String, Set<String>> entities = new LinkedHashMap<>();
        int dispatched = 0;
        int failed = 0;

        for (ActionResult actionResult : round) {
            Action action = actionResult.action();
            if (action.error() != null) {
                run.messages.add(Message.toolResult(action.callId(), errorObservation(action.error())));
                continue;
            }
            for (ToolInvocationResult result : actionResult.results()) {
                dispatched++;
                run.events.add(AgentEvent.toolResult(run.conversationId, new AgentEvent.ToolResultPayload(
                        result.toolName(), result.operation().wireName(), result.success(),
                        result.records().size(), result.errorMessage(),
                        result.duration() == null ? 0 : result.duration().toMillis(), result.fromCache()),
                        run.iteration));
                if (result.success()) {
                    answeredBy.add(result.toolName());
                    EntityExtractor.extract(result.operation(), result.records()).forEach((type, ids) ->
                            entities.computeIfAbsent(type, k -> new LinkedHashSet<>()).addAll(ids));
                } else {
                    failed++;
                    run.caveats.add(result.describeFailure());
                    run.lastError = result.describeFailure();
                }
            }
            run.messages.add(Message.toolResult(action.callId(), observation(actionResult.results())));
        }

        if (primaryRound && !answeredBy.isEmpty()) {
            Map<String, List<String>> resolved = new LinkedHashMap<>();
            entities.forEach((type, ids) -> resolved.put(type, new ArrayList<>(ids)));
            context.update(run.query, answeredBy.stream().distinct().toList(), resolved);
        }

        if (primaryRound && dispatched > 0) {
            run.consecutiveAllFailed = failed == dispatched ? run.consecutiveAllFailed + 1 : 0;
        }
        log.debug("[Agent:{}] Observed {} result(s), {} failed", run.conversationId, dispatched, failed);
    }

    private String observation(List<ToolInvocationResult> results) {
        ArrayNode array = objectMapper.createArrayNode();
        for (ToolInvocationResult result : results) {
            ObjectNode node = array.addObject();
            node.put("tool", result.toolName());
            node.put("operation", result.operation().wireName());
            node.put("success", result.success());
            if (result.success()) {
                List<NormalizedRecord> records = result.records();
                node.put("record_count", records.size());
                if (result.fromCache()) node.put("cached", true);
                ArrayNode recordArray = node.putArray("records");
                records.stream().limit(MAX_RECORDS_PER_OBSERVATION).forEach(record -> {
                    ObjectNode recordNode = recordArray.addObject();
                    if (settings.includeToolSource()) recordNode.put("source", record.toolName());
                    record.fields().forEach((field, value) -> recordNode.set(field, objectMapper.valueToTree(value)));
                });
                if (records.size() > MAX_RECORDS_PER_OBSERVATION) node.put("truncated", true);
            } else {
                node.put("error_kind", String.valueOf(result.errorKind()));
                node.put("error", result.errorMessage());
            }
        }
        return write(array);
    }

    private String errorObservation(String error) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("success", false);
        node.put("error", error);
        return write(node);
    }

    private List<Action> followUps(PlanResult plan, List<ActionResult> seedRound) {
        Map<String, Set<String>> entities = new LinkedHashMap<>();
        for (ActionResult actionResult : seedRound) {
            for (ToolInvocationResult result : actionResult.results()) {
                if (!result.success()) continue;
                EntityExtractor.extract(result.operation(), result.records()).forEach((type, ids) ->
                        entities.computeIfAbsent(type, k -> new LinkedHashSet<>()).addAll(ids));
            }
        }
        Map<String, Object> entityFilters = new LinkedHashMap<>();
        entities.forEach((type, ids) -> entityFilters.put(type, new ArrayList<>(ids)));

        List<Action> actions = new ArrayList<>();
        for (PlannedOperation followUp : plan.followUps()) {
            Action action = toAction(followUp.withDefaultFilters(entityFilters));
            actions.add(action.withCallId("followup-" + (actions.size() + 1)));
        }
        return actions;
    }

    // ── REASONING helpers ────────────────────────────────────────────────────

    private String systemPrompt(ContextManager context) {
        List<String> tools = registry.enabledTools().stream()
                .map(tool -> tool.aliases().isEmpty()
                        ? tool.name()
                        : "%s (aliases %s)".formatted(tool.name(), String.join(", ", tool.aliases())))
                .toList();
        String prompt = SYSTEM_PROMPT.formatted(QUERY_TOOL, String.join("; ", tools));
        String history = context.describe();
        return history.isEmpty() ? prompt : prompt + "\nConversation context:\n" + history;
    }

    private Tool queryTool() {
        ObjectNode schema = objectMapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");

        ObjectNode tool = properties.putObject("tool");
        tool.put("type", "string");
        tool.put("description", "Tool name or alias, or \"all\" for every enabled tool");
        ArrayNode toolEnum = tool.putArray("enum");
        registry.identifiers().forEach(toolEnum::add);
        toolEnum.add(ALL_TOOLS);

        ObjectNode operation = properties.putObject("operation");
        operation.put("type", "string");
        ArrayNode operationEnum = operation.putArray("enum");
        Arrays.stream(Operation.values()).forEach(op -> operationEnum.add(op.wireName()));

        ObjectNode filters = properties.putObject("filters");
        filters.put("type", "object");
        filters.put("description",
                "Optional filters such as device, rack, site, severity, status, metric, q");

        schema.putArray("required").add("tool").add("operation");
        return Tool.function(QUERY_TOOL, "Query a network management tool for devices, interfaces, "
                + "alerts, metrics, topology, device configuration or free-text search.", schema);
    }

    private Action parseToolCall(ToolCall call) {
        if (call.function() == null || !QUERY_TOOL.equals(call.function().name())) {
            String name = call.function() == null ? null : call.function().name();
            return Action.invalid(call.id(), "Unknown function '%s'; use %s".formatted(name, QUERY_TOOL));
        }
        JsonNode args;
        try {
            args = objectMapper.readTree(call.function().arguments() == null ? "{}" : call.function().arguments());
        } catch (JsonProcessingException e) {
            return Action.invalid(call.id(), "Arguments are not valid JSON: " + e.getOriginalMessage());
        }

        String toolArgument = args.path("tool").asText("");
        Operation operation;
        try {
            operation = Operation.fromName(args.path("operation").asText(""));
        } catch (IllegalArgumentException e) {
            return Action.invalid(call.id(), e.getMessage());
        }

        List<ToolSpec> targets;
        if (ALL_TOOLS.equalsIgnoreCase(toolArgument)) {
            targets = registry.enabledTools();
        } else {
            ToolSpec spec = registry.find(toolArgument).orElse(null);
            if (spec == null) {
                return Action.invalid(call.id(), "Unknown tool '%s'; known: %s"
                        .formatted(toolArgument, registry.identifiers()));
            }
            targets = List.of(spec);
        }

        Map<String, Object> filters = new LinkedHashMap<>();
        JsonNode filterNode = args.path("filters");
        if (filterNode.isObject()) {
            filterNode.fields().forEachRemaining(entry -> {
                Object value = objectMapper.convertValue(entry.getValue(), Object.class);
                if (value != null) filters.put(entry.getKey(), value);
            });
        }
        return new Action(call.id(), toolArgument, operation, filters, targets, null);
    }

    private Action toAction(PlannedOperation planned) {
        return new Action(null, planned.toolName(), planned.operation(), planned.filters(),
                List.of(registry.resolve(planned.toolName())), null);
    }

    private ToolCall toToolCall(Action action) {
        ObjectNode args = objectMapper.createObjectNode();
        args.put("tool", action.toolArgument());
        args.put("operation", action.operation().wireName());
        args.set("filters", objectMapper.valueToTree(action.filters()));
        return ToolCall.of(action.callId(), QUERY_TOOL, write(args));
    }

    private static List<ToolCall> withIds(List<ToolCall> calls, int iteration) {
        List<ToolCall> withIds = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            ToolCall call = calls.get(i);
            withIds.add(call.id() != null && !call.id().isBlank()
                    ? call
                    : new ToolCall("call-%d-%d".formatted(iteration, i + 1),
                            call.type() == null ? "function" : call.type(), call.function()));
        }
        return withIds;
    }

    private static boolean anySucceeded(List<ActionResult> round) {
        return round.stream().flatMap(r -> r.results().stream()).anyMatch(ToolInvocationResult::success);
    }

    private String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize observation", e);
        }
    }

    // ── Per-run state ────────────────────────────────────────────────────────

    private record DispatchKey(Operation operation, Map<String, Object> filters) {}

    private record ActionResult(Action action, List<ToolInvocationResult> results) {}

    /**
     * One requested tool query. {@code error} is set when the request could not
     * be understood; such actions are answered with the error and not dispatched.
     */
    private record Action(String callId,
                          String toolArgument,
                          Operation operation,
                          Map<String, Object> filters,
                          List<ToolSpec> targets,
                          String error) {

        static Action invalid(String callId, String error) {
            return new Action(callId, null, null, Map.of(), List.of(), error);
        }

        Action withCallId(String id) {
            return new Action(id, toolArgument, operation, filters, targets, error);
        }

        String describe() {
            return "%s %s %s".formatted(toolArgument, operation.label(), filters);
        }
    }

    private final class Run {

        private final String              conversationId;
        private final String              query;
        private final List<Message>       messages = new ArrayList<>();
        private final List<AgentEvent>    events   = new ArrayList<>();
        private final Set<String>         caveats  = new LinkedHashSet<>();
        private Map<String, Object>       implicitFilters = Map.of();
        private int                       iteration;
        private int                       consecutiveAllFailed;
        private String                    lastError;

        private Run(String conversationId, String query) {
            this.conversationId = conversationId;
            this.query          = query;
        }

        QueryOutcome done(String answer) {
            String finalAnswer = caveats.isEmpty()
                    ? answer
                    : answer + "\n\nNote: some data sources were unavailable: " + String.join("; ", caveats);
            events.add(AgentEvent.finalAnswer(conversationId, finalAnswer, iteration));
            log.info("[Agent:{}] Completed in {} iteration(s), {} caveat(s)", conversationId, iteration, caveats.size());
            return new QueryOutcome(LoopState.DONE, finalAnswer, null, null, new ArrayList<>(caveats),
                    iteration, implicitFilters, events);
        }

        QueryOutcome fail(FailureKind kind, String message) {
            events.add(AgentEvent.error(conversationId, message, iteration));
            log.warn("[Agent:{}] Failed ({}) after {} iteration(s): {}", conversationId, kind, iteration, message);
            return new QueryOutcome(LoopState.FAILED, null, kind, message, new ArrayList<>(caveats),
                    iteration, implicitFilters, events);
        }
    }
}
