package com.openforge.netagent.agent;

import com.openforge.netagent.adapter.AdapterErrorKind;
import com.openforge.netagent.adapter.Operation;
import com.openforge.netagent.agent.event.AgentEvent;
import com.openforge.netagent.agent.event.EventType;
import com.openforge.netagent.config.AgentProperties;
import com.openforge.netagent.config.AppConfig;
import com.openforge.netagent.config.ToolProperties;
import com.openforge.netagent.context.ContextManager;
import com.openforge.netagent.llm.LlmClient;
import com.openforge.netagent.llm.LlmProperties;
import com.openforge.netagent.llm.model.ChatRequest;
import com.openforge.netagent.llm.model.ChatResponse;
import com.openforge.netagent.llm.model.Message;
import com.openforge.netagent.llm.model.ToolCall;
import com.openforge.netagent.mapping.DataMapper;
import com.openforge.netagent.mapping.MappingRules;
import com.openforge.netagent.planner.FilterExtractor;
import com.openforge.netagent.planner.KeywordQueryMatcher;
import com.openforge.netagent.planner.QueryPatternLoader;
import com.openforge.netagent.planner.SemanticQueryPlanner;
import com.openforge.netagent.registry.ToolRegistry;
import com.openforge.netagent.support.FakeAdapter;
import com.openforge.netagent.support.MutableClock;
import com.openforge.netagent.support.ScriptedReasoningModel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end runs of the agent against in-memory adapters and a scripted model.
 */
class NetworkAgentTest {

    private static final LlmProperties LLM = new LlmProperties(
            new LlmProperties.ProviderConfig("test", "http://localhost", "key", "test-model", 5),
            null, null, null);

    private ExecutorService executor;
    private MutableClock clock;
    private FakeAdapter netbox;
    private FakeAdapter librenms;
    private ScriptedReasoningModel model;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        clock = MutableClock.atEpoch();
        netbox = new FakeAdapter();
        librenms = new FakeAdapter();
        model = new ScriptedReasoningModel();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private NetworkAgent agent(AgentProperties.Settings settings, int librenmsTimeoutSeconds) {
        ToolRegistry registry = new ToolRegistry(settings, executor, clock);
        registry.register("netbox", (name, config) -> netbox, ToolProperties.builder().build(),
                MappingRules.empty(), List.of("nx", "nbox"));
        registry.register("librenms", (name, config) -> librenms,
                ToolProperties.builder().timeoutSeconds(librenmsTimeoutSeconds).build(),
                MappingRules.empty(), List.of("libre", "lnms"));

        SemanticQueryPlanner planner = new SemanticQueryPlanner(registry,
                QueryPatternLoader.load("classpath:patterns/query-patterns.yml"),
                new KeywordQueryMatcher(), new FilterExtractor(), settings);
        ReActLoop loop = new ReActLoop(planner, registry, new DataMapper(settings.standardizeOutput()),
                model, AppConfig.defaultObjectMapper(), settings, LLM);
        AgentProperties properties = new AgentProperties(settings, Map.of(), null);
        return new NetworkAgent(properties, registry, loop, clock, null);
    }

    private NetworkAgent agent(AgentProperties.Settings settings) {
        return agent(settings, 5);
    }

    private static AgentProperties.Settings.SettingsBuilder settings() {
        return AgentProperties.Settings.builder().cacheDurationMinutes(0).retryWaitMillis(1L);
    }

    private static List<Message> toolMessages(ChatRequest request) {
        return request.messages().stream().filter(m -> "tool".equals(m.role())).toList();
    }

    // ── Scenarios ────────────────────────────────────────────────────────────

    @Test
    @DisplayName("A timed-out monitoring tool becomes a caveat while the inventory tool still answers")
    void partialFailureBecomesCaveat() {
        // Given
        librenms.respond(Operation.LIST_ALERTS, "[]").delay(Duration.ofSeconds(5));
        netbox.respond(Operation.LIST_ALERTS, "[{\"device\": \"sw1\", \"severity\": \"critical\"}]")
              .respond(Operation.LIST_DEVICES, "[{\"name\": \"sw1\", \"rack\": \"A1\"}]");
        model.answer("sw1 has a critical alert.");
        NetworkAgent agent = agent(settings().build(), 1);

        // When
        QueryOutcome outcome = agent.run("Show me all devices with critical alerts");

        // Then
        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.answer())
                .startsWith("sw1 has a critical alert.")
                .contains("some data sources were unavailable")
                .contains("librenms: TIMEOUT");
        assertThat(outcome.caveats()).singleElement().asString().startsWith("librenms");
        assertThat(toolMessages(model.requests().get(0)))
                .anySatisfy(m -> assertThat(m.content()).contains("sw1").contains("\"success\":true"));
        assertThat(netbox.calls()).extracting(FakeAdapter.Call::operation)
                .contains(Operation.LIST_ALERTS, Operation.LIST_DEVICES);
    }

    @Test
    @DisplayName("A follow-up question inherits the devices the previous answer resolved")
    void followUpInheritsDevices() {
        // Given
        netbox.respond(Operation.LIST_DEVICES, "[{\"name\": \"sw1\"}, {\"name\": \"sw2\"}]")
              .respond(Operation.LIST_INTERFACES, "[{\"name\": \"eth0\", \"device\": \"sw1\"}]");
        librenms.respond(Operation.LIST_INTERFACES, "[]");
        model.answer("Rack A1 holds sw1 and sw2.").answer("eth0 on sw1 is up.");
        NetworkAgent agent = agent(settings().build());

        // When
        String first = agent.processQuery("@nx show devices in rack A1");
        QueryOutcome second = agent.run("What are their interface statuses?");

        // Then
        assertThat(first).isEqualTo("Rack A1 holds sw1 and sw2.");
        assertThat(second.implicitFilters()).isEqualTo(Map.of("device", List.of("sw1", "sw2")));
        assertThat(netbox.calls()).filteredOn(call -> call.operation() == Operation.LIST_INTERFACES)
                .singleElement()
                .satisfies(call -> assertThat(call.filters()).containsEntry("device", List.of("sw1", "sw2")));
        assertThat(second.answer()).isEqualTo("eth0 on sw1 is up.");
    }

    @Test
    @DisplayName("A separate conversation does not see another conversation's context")
    void conversationsAreIsolated() {
        // Given
        netbox.respond(Operation.LIST_DEVICES, "[{\"name\": \"sw1\"}]")
              .respond(Operation.LIST_INTERFACES, "[]");
        librenms.respond(Operation.LIST_INTERFACES, "[]");
        NetworkAgent agent = agent(settings().build());
        agent.processQuery("@nx show devices in rack A1");

        // When
        QueryOutcome other = agent.newConversation().run("What are their interface statuses?");

        // Then
        assertThat(other.implicitFilters()).isEmpty();
    }

    @Test
    @DisplayName("The loop stops with REASONING_EXHAUSTED after max-iterations rounds")
    void iterationCapEndsTheLoop() {
        // Given
        netbox.respond(Operation.LIST_DEVICES, "[{\"name\": \"sw1\"}]");
        model.otherwise(request -> ChatResponse.of(Message.assistantToolCalls(List.of(new ToolCall(null, null,
                new ToolCall.FunctionCall(ReActLoop.QUERY_TOOL,
                        "{\"tool\": \"nx\", \"operation\": \"list_devices\"}"))))));
        NetworkAgent agent = agent(settings().maxIterations(3).build());

        // When
        QueryOutcome outcome = agent.run("@nx list devices");

        // Then
        assertThat(outcome.state()).isEqualTo(LoopState.FAILED);
        assertThat(outcome.failureKind()).isEqualTo(FailureKind.REASONING_EXHAUSTED);
        assertThat(outcome.iterations()).isEqualTo(3);
        assertThat(model.requests()).hasSize(3);
        assertThat(model.lastRequest().messages())
                .filteredOn(m -> m.toolCalls() != null)
                .flatExtracting(Message::toolCalls)
                .extracting(ToolCall::id)
                .contains("plan-1", "call-1-1", "call-2-1");
        assertThat(outcome.events()).last().extracting(AgentEvent::type).isEqualTo(EventType.ERROR);
        assertThatThrownBy(outcome::answerOrThrow)
                .isInstanceOfSatisfying(QueryFailedException.class,
                        e -> assertThat(e.kind()).isEqualTo(FailureKind.REASONING_EXHAUSTED));
    }

    @Test
    @DisplayName("Two consecutive rounds in which every tool fails end with ADAPTER_FAILURE")
    void repeatedTotalFailure() {
        // Given
        netbox.fail(Operation.LIST_DEVICES, AdapterErrorKind.UNAUTHORIZED, "token revoked");
        model.callTool("c1", "{\"tool\": \"netbox\", \"operation\": \"list_devices\"}");
        NetworkAgent agent = agent(settings().build());

        // When / Then
        assertThatThrownBy(() -> agent.processQuery("@nx list devices"))
                .hasMessageContaining("UNAUTHORIZED")
                .isInstanceOfSatisfying(QueryFailedException.class,
                        e -> assertThat(e.kind()).isEqualTo(FailureKind.ADAPTER_FAILURE));
        assertThat(model.requests()).hasSize(1);
    }

    @Test
    @DisplayName("An unreachable model ends with LLM_UNAVAILABLE")
    void modelUnavailable() {
        // Given
        netbox.respond(Operation.LIST_DEVICES, "[]");
        model.reply(request -> {
            throw new LlmClient.LlmException("all providers down");
        });
        NetworkAgent agent = agent(settings().build());

        // When
        QueryOutcome outcome = agent.run("@nx list devices");

        // Then
        assertThat(outcome.failureKind()).isEqualTo(FailureKind.LLM_UNAVAILABLE);
        assertThat(outcome.message()).contains("all providers down");
    }

    @Test
    @DisplayName("Without query-all, an unmatched query fails as PLANNING_AMBIGUOUS with alias hints")
    void ambiguousQuery() {
        // Given
        NetworkAgent agent = agent(settings().queryAllEnabled(false).build());

        // When
        QueryOutcome outcome = agent.run("what is going on");

        // Then
        assertThat(outcome.failureKind()).isEqualTo(FailureKind.PLANNING_AMBIGUOUS);
        assertThat(outcome.message()).contains("@nx");
        assertThat(model.requests()).isEmpty();
    }

    // ── Tool calls from the model ────────────────────────────────────────────

    @Test
    @DisplayName("Tool 'all' fans out to every enabled tool; unknown tools are answered with an error")
    void modelToolCalls() {
        // Given
        netbox.respond(Operation.LIST_DEVICES, "[]")
              .respond(Operation.SEARCH, "[{\"name\": \"sw9\"}]");
        librenms.respond(Operation.SEARCH, "[{\"hostname\": \"sw9\"}]");
        model.callTool("c1", "{\"tool\": \"all\", \"operation\": \"search\", \"filters\": {\"q\": \"sw9\"}}")
             .callTool("c2", "{\"tool\": \"zabbix\", \"operation\": \"search\"}")
             .answer("sw9 is known to both tools.");
        NetworkAgent agent = agent(settings().build());

        // When
        QueryOutcome outcome = agent.run("@nx list devices");

        // Then
        assertThat(outcome.answer()).isEqualTo("sw9 is known to both tools.");
        assertThat(netbox.calls()).extracting(FakeAdapter.Call::operation).contains(Operation.SEARCH);
        assertThat(librenms.calls()).singleElement()
                .satisfies(call -> assertThat(call.filters()).containsEntry("q", "sw9"));
        assertThat(toolMessages(model.lastRequest()))
                .anySatisfy(m -> assertThat(m.content()).contains("Unknown tool 'zabbix'"));
        assertThat(outcome.events()).extracting(AgentEvent::type)
                .contains(EventType.PLAN_READY, EventType.TOOL_CALL, EventType.TOOL_RESULT, EventType.FINAL_ANSWER);
    }

    @Test
    @DisplayName("A blank answer is nudged instead of returned")
    void blankAnswerIsNudged() {
        // Given
        netbox.respond(Operation.LIST_DEVICES, "[]");
        model.answer("  ").answer("No devices found.");
        NetworkAgent agent = agent(settings().build());

        // When
        String answer = agent.processQuery("@nx list devices");

        // Then
        assertThat(answer).isEqualTo("No devices found.");
        assertThat(model.requests()).hasSize(2);
    }

    @Test
    @DisplayName("Records in observations are tagged with their source tool")
    void observationsCarrySource() {
        // Given
        netbox.respond(Operation.LIST_DEVICES, "[{\"name\": \"sw1\"}]");
        NetworkAgent agent = agent(settings().build());

        // When
        agent.run("@nx list devices");

        // Then
        assertThat(toolMessages(model.lastRequest())).singleElement()
                .satisfies(m -> assertThat(m.content()).contains("\"source\":\"netbox\"").contains("\"record_count\":1"));
    }

    @Test
    @DisplayName("Context expires after the context timeout")
    void contextExpires() {
        // Given
        netbox.respond(Operation.LIST_DEVICES, "[{\"name\": \"sw1\"}]")
              .respond(Operation.LIST_INTERFACES, "[]");
        librenms.respond(Operation.LIST_INTERFACES, "[]");
        NetworkAgent agent = agent(settings().contextTimeout(300).build());
        agent.processQuery("@nx show devices in rack A1");

        // When
        clock.advance(Duration.ofSeconds(301));
        QueryOutcome outcome = agent.run("What are their interface statuses?");

        // Then
        assertThat(outcome.implicitFilters()).isEmpty();
        ContextManager context = agent.defaultConversation().context();
        assertThat(context.entries()).hasSize(1);
    }

    @Test
    @DisplayName("Clearing a conversation's context stops back-references from resolving")
    void clearContext() {
        // Given
        netbox.respond(Operation.LIST_DEVICES, "[{\"name\": \"sw1\"}]")
              .respond(Operation.LIST_INTERFACES, "[]");
        librenms.respond(Operation.LIST_INTERFACES, "[]");
        NetworkAgent agent = agent(settings().build());
        Conversation conversation = agent.newConversation("ops");
        conversation.ask("@nx show devices in rack A1");

        // When
        conversation.clearContext();
        QueryOutcome outcome = conversation.run("What are their interface statuses?");

        // Then
        assertThat(conversation.id()).isEqualTo("ops");
        assertThat(outcome.implicitFilters()).isEmpty();
    }
}
