package com.openforge.netagent.config;

import com.openforge.netagent.agent.NetworkAgent;
import com.openforge.netagent.adapter.AdapterException;
import com.openforge.netagent.llm.LlmProperties;
import com.openforge.netagent.registry.ToolSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Prints a structured startup summary after the application context is ready.
 *
 * Checks performed:
 *   - Tools: registration, aliases and a live connection probe per enabled tool
 *   - LLM providers: primary + fallback config (API key is masked)
 *   - Settings: the effective agent.settings values
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final NetworkAgent  networkAgent;
    private final LlmProperties llmProperties;
    private final Environment   env;

    @Override
    public void run(ApplicationArguments args) {
        String port = env.getProperty("server.port", "8080");
        String tools = networkAgent.toolManager().tools().stream()
                .map(tool -> "║    %-14s: aliases=%s  enabled=%s  %s".formatted(
                        tool.name(), tool.aliases(), tool.enabled(), probe(tool)))
                .collect(Collectors.joining("\n"));
        AgentProperties.Settings settings = networkAgent.settings();

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║            Net Agent  :  Startup Summary                 ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Tools                                                   ║
                {}
                ╠══════════════════════════════════════════════════════════╣
                ║  LLM Providers                                           ║
                ║    Primary        : {}  [{}]  key={}
                ║    Fallback       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Settings                                                ║
                ║    Query all      : {}   concurrent={}
                ║    Timeouts       : tool={}s  context={}s
                ║    Cache          : {} min   retries={}   iterations={}
                ╚══════════════════════════════════════════════════════════╝
                """,
                port,
                System.getProperty("java.version"),

                tools.isEmpty() ? "║    (none)" : tools,

                llmProperties.primary().name(),
                llmProperties.primary().model(),
                maskKey(llmProperties.primary().apiKey()),
                llmProperties.hasFallback()
                        ? "%s  [%s]  key=%s".formatted(llmProperties.fallback().name(),
                                llmProperties.fallback().model(), maskKey(llmProperties.fallback().apiKey()))
                        : "(none)",

                settings.queryAllEnabled(), settings.concurrentQueries(),
                settings.timeoutSeconds(), settings.contextTimeout(),
                settings.cacheDurationMinutes(), settings.maxRetries(), settings.maxIterations()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Calls the adapter's connection check. Returns a one-line status.
     */
    private static String probe(ToolSpec tool) {
        if (!tool.enabled()) return "- skipped";
        try {
            return tool.adapter().validateConnection() ? "✔ reachable" : "✘ unreachable";
        } catch (ConfigurationException | AdapterException e) {
            return "✘ FAILED: " + e.getMessage();
        }
    }

    /**
     * Masks an API key: shows first 6 chars + "..." + last 4 chars.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank()) return "(not set)";
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
