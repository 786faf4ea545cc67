package com.openforge.netagent.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.openforge.netagent.adapter.AdapterType;
import com.openforge.netagent.llm.LlmProperties;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads {@link AgentConfiguration} from environment variables or from a YAML
 * file shaped like the {@code agent:} block of {@code application.yml}.
 *
 * Environment variables:
 *   NETBOX_URL, NETBOX_TOKEN, NETBOX_ALIASES
 *   LIBRENMS_URL, LIBRENMS_TOKEN, LIBRENMS_ALIASES
 *   LLM_BASE_URL, LLM_API_KEY, LLM_MODEL, LLM_TEMPERATURE
 *   QUERY_ALL_ENABLED, CONCURRENT_QUERIES, TIMEOUT_SECONDS, CONTEXT_TIMEOUT,
 *   CACHE_DURATION_MINUTES, MAX_RETRIES, MAX_ITERATIONS, PATTERNS_FILE
 *
 * A tool is configured when its URL is set; its token is then mandatory.
 */
@Slf4j
public final class AgentConfigLoader {

    public static final String DEFAULT_LLM_BASE_URL = "https://api.openai.com/v1";
    public static final String DEFAULT_LLM_MODEL    = "gpt-4o";

    private static final List<String> NETBOX_DEFAULT_ALIASES   = List.of("nx", "nbox");
    private static final List<String> LIBRENMS_DEFAULT_ALIASES = List.of("libre", "lnms");

    private static final Pattern PLACEHOLDER =
            Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)(?::([^}]*))?}");

    private static final YAMLMapper YAML = YAMLMapper.builder()
            .propertyNamingStrategy(PropertyNamingStrategies.KEBAB_CASE)
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private AgentConfigLoader() {}

    // ── Environment ──────────────────────────────────────────────────────────

    public static AgentConfiguration fromEnvironment(EnvironmentSource env) {
        Map<String, ToolProperties> tools = new LinkedHashMap<>();
        envTool(env, "NETBOX", AdapterType.NETBOX, NETBOX_DEFAULT_ALIASES)
                .forEach(config -> tools.put("netbox", config));
        envTool(env, "LIBRENMS", AdapterType.LIBRENMS, LIBRENMS_DEFAULT_ALIASES)
                .forEach(config -> tools.put("librenms", config));
        if (tools.isEmpty()) {
            throw new ConfigurationException("No network tool configured; set NETBOX_URL or LIBRENMS_URL");
        }

        LlmProperties llm = new LlmProperties(
                new LlmProperties.ProviderConfig("primary",
                        env.get("LLM_BASE_URL").orElse(DEFAULT_LLM_BASE_URL),
                        env.require("LLM_API_KEY"),
                        env.get("LLM_MODEL").orElse(DEFAULT_LLM_MODEL),
                        null),
                null,
                number(env, "LLM_TEMPERATURE", Double::valueOf),
                null);

        AgentProperties agent = new AgentProperties(
                applySettingOverrides(AgentProperties.Settings.builder().build(), env),
                tools,
                env.get("PATTERNS_FILE").orElse(null));

        log.info("[Config] Loaded from environment: tools={}", tools.keySet());
        return new AgentConfiguration(agent, llm);
    }

    private static List<ToolProperties> envTool(EnvironmentSource env, String prefix,
                                                AdapterType type, List<String> defaultAliases) {
        return env.get(prefix + "_URL")
                .map(url -> ToolProperties.builder()
                        .type(type)
                        .baseUrl(url)
                        .apiToken(env.get(prefix + "_TOKEN").orElseThrow(() -> new ConfigurationException(
                                "%s_URL is set but %s_TOKEN is missing".formatted(prefix, prefix))))
                        .aliases(env.get(prefix + "_ALIASES").map(AgentConfigLoader::splitList).orElse(defaultAliases))
                        .build())
                .map(List::of)
                .orElse(List.of());
    }

    // ── YAML file ────────────────────────────────────────────────────────────

    /**
     * Reads the {@code agent} block of a YAML file. {@code ${VAR}} and
     * {@code ${VAR:default}} placeholders are substituted from {@code env}
     * before parsing; environment settings variables then override the file.
     */
    public static AgentConfiguration fromYaml(Path file, EnvironmentSource env) {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read config file " + file.toAbsolutePath(), e);
        }
        return parseYaml(substitute(text, env), env);
    }

    static AgentConfiguration parseYaml(String yaml, EnvironmentSource env) {
        try {
            JsonNode root  = YAML.readTree(yaml);
            JsonNode agent = root == null ? null : root.path("agent");
            if (agent == null || !agent.isObject()) {
                throw new ConfigurationException("Config file has no 'agent' section");
            }
            AgentProperties properties = YAML.treeToValue(agent, AgentProperties.class);
            LlmProperties llm = agent.has("llm") ? YAML.treeToValue(agent.get("llm"), LlmProperties.class) : null;

            AgentProperties overridden = new AgentProperties(
                    applySettingOverrides(properties.settings(), env),
                    properties.tools(),
                    env.get("PATTERNS_FILE").orElse(properties.patternsFile()));
            return new AgentConfiguration(overridden, llm);
        } catch (IOException e) {
            throw new ConfigurationException("Invalid config file: " + e.getMessage(), e);
        }
    }

    static String substitute(String text, EnvironmentSource env) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String fallback = matcher.group(2);
            String value = env.get(name).orElseGet(() -> {
                if (fallback == null) {
                    throw new ConfigurationException("Environment variable %s is not set".formatted(name));
                }
                return fallback;
            });
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static AgentProperties.Settings applySettingOverrides(AgentProperties.Settings settings,
                                                                 EnvironmentSource env) {
        AgentProperties.Settings.SettingsBuilder builder = settings.toBuilder();
        env.get("QUERY_ALL_ENABLED").map(Boolean::valueOf).ifPresent(builder::queryAllEnabled);
        env.get("CONCURRENT_QUERIES").map(Boolean::valueOf).ifPresent(builder::concurrentQueries);
        integer(env, "TIMEOUT_SECONDS", builder::timeoutSeconds);
        integer(env, "CONTEXT_TIMEOUT", builder::contextTimeout);
        integer(env, "CACHE_DURATION_MINUTES", builder::cacheDurationMinutes);
        integer(env, "MAX_RETRIES", builder::maxRetries);
        integer(env, "MAX_ITERATIONS", builder::maxIterations);
        return builder.build();
    }

    private static void integer(EnvironmentSource env, String name,
                                Function<Integer, AgentProperties.Settings.SettingsBuilder> setter) {
        Integer value = number(env, name, Integer::valueOf);
        if (value != null) setter.apply(value);
    }

    private static <T> T number(EnvironmentSource env, String name, Function<String, T> parser) {
        return env.get(name).map(raw -> {
            try {
                return parser.apply(raw);
            } catch (NumberFormatException e) {
                throw new ConfigurationException("%s is not a number: '%s'".formatted(name, raw), e);
            }
        }).orElse(null);
    }

    private static List<String> splitList(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
