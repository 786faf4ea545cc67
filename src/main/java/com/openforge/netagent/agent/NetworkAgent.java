package com.openforge.netagent.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.netagent.adapter.AdapterFactory;
import com.openforge.netagent.adapter.AdapterType;
import com.openforge.netagent.config.AgentConfigLoader;
import com.openforge.netagent.config.AgentConfiguration;
import com.openforge.netagent.config.AgentProperties;
import com.openforge.netagent.config.AppConfig;
import com.openforge.netagent.config.ConfigurationException;
import com.openforge.netagent.config.EnvironmentSource;
import com.openforge.netagent.config.ToolProperties;
import com.openforge.netagent.context.ContextManager;
import com.openforge.netagent.llm.LlmProperties;
import com.openforge.netagent.llm.LlmRouter;
import com.openforge.netagent.llm.ReasoningModel;
import com.openforge.netagent.mapping.DataMapper;
import com.openforge.netagent.mapping.MappingRules;
import com.openforge.netagent.mapping.MappingRulesLoader;
import com.openforge.netagent.planner.FilterExtractor;
import com.openforge.netagent.planner.KeywordQueryMatcher;
import com.openforge.netagent.planner.QueryPatternLoader;
import com.openforge.netagent.planner.SemanticQueryPlanner;
import com.openforge.netagent.registry.ToolRegistry;
import com.openforge.netagent.registry.ToolSpec;
import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Collection;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for answering natural-language questions about the network.
 *
 * Usage outside Spring:
 * <pre>
 * try (NetworkAgent agent = NetworkAgent.fromEnvironment()) {
 *     String answer = agent.processQuery("@nx show me all devices in rack A1");
 * }
 * </pre>
 *
 * {@link #processQuery} and {@link #run} use the agent's default conversation,
 * so follow-up questions see the context of earlier ones.
 * {@link #newConversation()} starts an independent one.
 */
@Slf4j
public class NetworkAgent implements AutoCloseable {

    private final AgentProperties  properties;
    private final ToolRegistry     registry;
    private final ReActLoop        loop;
    private final Clock            clock;
    private final ExecutorService  ownedExecutor;
    private final Conversation     defaultConversation;

    public NetworkAgent(AgentProperties properties,
                        ToolRegistry registry,
                        ReActLoop loop,
                        Clock clock,
                        ExecutorService ownedExecutor) {
        this.properties          = properties;
        this.registry            = registry;
        this.loop                = loop;
        this.clock               = clock;
        this.ownedExecutor       = ownedExecutor;
        this.defaultConversation = newConversation("default");
    }

    // ── Factories ────────────────────────────────────────────────────────────

    /** Configuration from environment variables and {@code ./.env}. */
    public static NetworkAgent fromEnvironment() {
        return standalone(AgentConfigLoader.fromEnvironment(EnvironmentSource.system()));
    }

    /** Configuration from a YAML file with {@code ${VAR}} placeholders. */
    public static NetworkAgent fromConfigFile(Path file) {
        return standalone(AgentConfigLoader.fromYaml(file, EnvironmentSource.system()));
    }

    private static NetworkAgent standalone(AgentConfiguration configuration) {
        HttpClient   httpClient   = AppConfig.defaultHttpClient();
        ObjectMapper objectMapper = AppConfig.defaultObjectMapper();
        ExecutorService executor  = AppConfig.defaultExecutor();
        try {
            ReasoningModel model = LlmRouter.create(httpClient, objectMapper, configuration.llm());
            return create(configuration.agent(), configuration.llm(), model,
                    httpClient, objectMapper, executor, Clock.systemUTC(), true);
        } catch (RuntimeException e) {
            executor.shutdownNow();
            throw e;
        }
    }

    /**
     * Builds the registry, planner and loop and registers every configured tool.
     *
     * @param ownsExecutor whether {@link #close()} shuts {@code executor} down
     * @throws ConfigurationException for missing or invalid settings
     */
    public static NetworkAgent create(AgentProperties properties,
                                      LlmProperties llmProperties,
                                      ReasoningModel model,
                                      HttpClient httpClient,
                                      ObjectMapper objectMapper,
                                      ExecutorService executor,
                                      Clock clock,
                                      boolean ownsExecutor) {
        AgentProperties.Settings settings = properties.settings();
        ToolRegistry registry = new ToolRegistry(settings, executor, clock);

        properties.tools().forEach((name, config) -> {
            AdapterType type = config.type() != null
                    ? config.type()
                    : AdapterType.fromToolName(name).orElseThrow(() -> new ConfigurationException(
                            "Tool '%s' has no type and none can be derived from its name".formatted(name)));
            String mappingsFile = config.mappingsFile() != null ? config.mappingsFile() : type.defaultMappingsFile();
            registry.register(name, type.factory(httpClient, objectMapper), config,
                    MappingRulesLoader.load(mappingsFile), config.aliases());
        });

        SemanticQueryPlanner planner = new SemanticQueryPlanner(registry,
                QueryPatternLoader.load(properties.patternsFile()),
                new KeywordQueryMatcher(), new FilterExtractor(), settings);
        ReActLoop loop = new ReActLoop(planner, registry, new DataMapper(settings.standardizeOutput()),
                model, objectMapper, settings, llmProperties);

        log.info("[NetworkAgent] Ready: {} tool(s), {} pattern(s)", registry.tools().size(), planner.patterns().size());
        return new NetworkAgent(properties, registry, loop, clock, ownsExecutor ? executor : null);
    }

    // ── Queries ──────────────────────────────────────────────────────────────

    /**
     * Answers {@code query} on the default conversation.
     *
     * @throws QueryFailedException when the query cannot be answered
     */
    public String processQuery(String query) {
        return defaultConversation.ask(query);
    }

    public QueryOutcome run(String query) {
        return defaultConversation.run(query);
    }

    public Conversation newConversation() {
        return newConversation(UUID.randomUUID().toString());
    }

    public Conversation newConversation(String id) {
        AgentProperties.Settings settings = properties.settings();
        ContextManager context = new ContextManager(settings.contextTimeoutDuration(),
                settings.maxHistory(), clock, new FilterExtractor());
        return new Conversation(id, context, loop);
    }

    public Conversation defaultConversation() {
        return defaultConversation;
    }

    // ── Tools ────────────────────────────────────────────────────────────────

    public ToolRegistry toolManager() {
        return registry;
    }

    /**
     * Registers a tool at runtime. Mapping rules come from
     * {@code config.mappingsFile()} when set.
     */
    public ToolSpec registerTool(String name, AdapterFactory factory, ToolProperties config,
                                 Collection<String> aliases) {
        MappingRules rules = config != null && config.mappingsFile() != null
                ? MappingRulesLoader.load(config.mappingsFile())
                : MappingRules.empty();
        return registry.register(name, factory, config, rules, aliases);
    }

    public Map<String, ToolProperties> configuredTools() {
        return properties.tools();
    }

    public AgentProperties.Settings settings() {
        return properties.settings();
    }

    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
            log.info("[NetworkAgent] Closed");
        }
    }
}
