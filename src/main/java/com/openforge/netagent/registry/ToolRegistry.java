package com.openforge.netagent.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.netagent.adapter.AdapterErrorKind;
import com.openforge.netagent.adapter.AdapterException;
import com.openforge.netagent.adapter.AdapterFactory;
import com.openforge.netagent.adapter.NetworkToolAdapter;
import com.openforge.netagent.adapter.Operation;
import com.openforge.netagent.config.AgentProperties;
import com.openforge.netagent.config.Resilience4jConfig;
import com.openforge.netagent.config.ToolProperties;
import com.openforge.netagent.mapping.MappingRules;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Holds the registered tools and fans operations out to them.
 *
 * Dispatch contract:
 *   - one result per requested target, in target order
 *   - a target's failure or timeout never affects its siblings
 *   - each call is bounded by the tool's timeout (retries included);
 *     a late call is cancelled and reported as TIMEOUT
 *
 * Registration is expected to finish before concurrent dispatch starts;
 * the registry does no locking of its own.
 */
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolSpec> tools      = new LinkedHashMap<>();
    private final Map<String, String>   aliasIndex = new LinkedHashMap<>();

    private final AgentProperties.Settings settings;
    private final ExecutorService          executor;
    private final ResultCache              cache;
    private final RetryRegistry            retryRegistry;

    public ToolRegistry(AgentProperties.Settings settings, ExecutorService executor, Clock clock) {
        this.settings      = settings;
        this.executor      = executor;
        this.cache         = new ResultCache(settings.cacheDuration(), clock);
        this.retryRegistry = RetryRegistry.of(Resilience4jConfig.adapterRetryConfig(
                settings.maxRetries(), Duration.ofMillis(settings.retryWaitMillis())));
    }

    // ── Registration ─────────────────────────────────────────────────────────

    /**
     * Builds the adapter eagerly and stores the tool.
     *
     * @throws DuplicateToolException if the name or any alias is already taken
     *                                by any registered name or alias
     */
    public ToolSpec register(String name,
                             AdapterFactory adapterFactory,
                             ToolProperties config,
                             MappingRules mappingRules,
                             Collection<String> aliases) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        ToolProperties effectiveConfig = config != null ? config : ToolProperties.builder().build();
        List<String> aliasList = aliases == null ? List.of() : List.copyOf(aliases);

        if (isTaken(name)) {
            throw new DuplicateToolException("Tool name '%s' is already registered".formatted(name));
        }
        Set<String> seen = new HashSet<>();
        seen.add(name);
        for (String alias : aliasList) {
            if (isTaken(alias) || !seen.add(alias)) {
                throw new DuplicateToolException(
                        "Alias '%s' for tool '%s' is already in use".formatted(alias, name));
            }
        }

        NetworkToolAdapter adapter = adapterFactory.create(name, effectiveConfig);
        Duration timeout = Duration.ofSeconds(effectiveConfig.timeoutSeconds() != null
                ? effectiveConfig.timeoutSeconds() : settings.timeoutSeconds());

        ToolSpec spec = new ToolSpec(name, aliasList, effectiveConfig.isEnabled(),
                effectiveConfig, mappingRules, adapter, timeout);
        tools.put(name, spec);
        aliasList.forEach(alias -> aliasIndex.put(alias, name));

        log.info("[Registry] Registered tool '{}' aliases={} enabled={} timeout={}s",
                name, aliasList, spec.enabled(), timeout.toSeconds());
        return spec;
    }

    public void deregister(String name) {
        ToolSpec removed = tools.remove(name);
        if (removed == null) {
            throw new UnknownToolException(name);
        }
        removed.aliases().forEach(aliasIndex::remove);
        cache.evictTool(name);
        log.info("[Registry] Deregistered tool '{}'", name);
    }

    // ── Lookup ───────────────────────────────────────────────────────────────

    /** Exact, case-sensitive match on canonical name first, then alias. */
    public ToolSpec resolve(String identifier) {
        return find(identifier).orElseThrow(() -> new UnknownToolException(identifier));
    }

    public Optional<ToolSpec> find(String identifier) {
        if (identifier == null) return Optional.empty();
        ToolSpec byName = tools.get(identifier);
        if (byName != null) return Optional.of(byName);
        String canonical = aliasIndex.get(identifier);
        return canonical == null ? Optional.empty() : Optional.ofNullable(tools.get(canonical));
    }

    /** All tools in registration order. */
    public List<ToolSpec> tools() {
        return List.copyOf(tools.values());
    }

    /** Enabled tools in registration order. */
    public List<ToolSpec> enabledTools() {
        return tools.values().stream().filter(ToolSpec::enabled).toList();
    }

    /** Every identifier {@code resolve} accepts: names, then aliases. */
    public List<String> identifiers() {
        List<String> ids = new ArrayList<>(tools.keySet());
        ids.addAll(aliasIndex.keySet());
        return ids;
    }

    // ── Dispatch ─────────────────────────────────────────────────────────────

    public List<ToolInvocationResult> dispatchAll(Operation operation, Map<String, Object> filters) {
        return dispatch(enabledTools(), operation, filters);
    }

    public List<ToolInvocationResult> dispatch(List<ToolSpec> targets,
                                               Operation operation,
                                               Map<String, Object> filters) {
        if (targets == null || targets.isEmpty()) return List.of();
        Map<String, Object> safeFilters = filters == null ? Map.of() : new LinkedHashMap<>(filters);

        boolean concurrent = settings.concurrentQueries() && targets.size() > 1;
        log.debug("[Registry] {} → {} target(s) {} filters={}", operation.wireName(), targets.size(),
                concurrent ? "concurrently" : "sequentially", safeFilters);

        return concurrent
                ? dispatchConcurrently(targets, operation, safeFilters)
                : dispatchSequentially(targets, operation, safeFilters);
    }

    private List<ToolInvocationResult> dispatchConcurrently(List<ToolSpec> targets,
                                                            Operation operation,
                                                            Map<String, Object> filters) {
        long startNanos = System.nanoTime();
        List<Future<ToolInvocationResult>> futures = new ArrayList<>(targets.size());
        List<ToolInvocationResult> immediate = new ArrayList<>(targets.size());

        for (ToolSpec target : targets) {
            ToolInvocationResult shortcut = shortcut(target, operation, filters);
            immediate.add(shortcut);
            futures.add(shortcut == null ? submit(target, operation, filters) : null);
        }

        List<ToolInvocationResult> results = new ArrayList<>(targets.size());
        for (int i = 0; i < targets.size(); i++) {
            ToolSpec target = targets.get(i);
            results.add(immediate.get(i) != null
                    ? immediate.get(i)
                    : await(target, operation, futures.get(i), startNanos));
        }
        return results;
    }

    private List<ToolInvocationResult> dispatchSequentially(List<ToolSpec> targets,
                                                            Operation operation,
                                                            Map<String, Object> filters) {
        List<ToolInvocationResult> results = new ArrayList<>(targets.size());
        for (ToolSpec target : targets) {
            ToolInvocationResult shortcut = shortcut(target, operation, filters);
            if (shortcut != null) {
                results.add(shortcut);
                continue;
            }
            long startNanos = System.nanoTime();
            results.add(await(target, operation, submit(target, operation, filters), startNanos));
        }
        return results;
    }

    /** Result that needs no backend call: disabled target, unsupported operation or cache hit. */
    private ToolInvocationResult shortcut(ToolSpec target, Operation operation, Map<String, Object> filters) {
        if (!target.enabled()) {
            return ToolInvocationResult.failure(target.name(), operation, AdapterErrorKind.BACKEND_ERROR,
                    "tool is disabled", Duration.ZERO);
        }
        if (!target.adapter().supportedOperations().contains(operation)) {
            log.debug("[Registry] {} does not support {}", target.name(), operation.wireName());
            return ToolInvocationResult.failure(target.name(), operation, AdapterErrorKind.BACKEND_ERROR,
                    AdapterException.unsupported(target.name(), operation).getMessage(), Duration.ZERO);
        }
        return cache.get(target.name(), operation, filters)
                .map(raw -> ToolInvocationResult.success(target.name(), operation, raw, Duration.ZERO).asCached())
                .orElse(null);
    }

    private Future<ToolInvocationResult> submit(ToolSpec target, Operation operation, Map<String, Object> filters) {
        Retry retry = retryRegistry.retry(target.name());
        return executor.submit(() -> {
            long callStart = System.nanoTime();
            JsonNode raw = Retry.decorateSupplier(retry,
                    () -> target.adapter().invoke(operation, filters)).get();
            cache.put(target.name(), operation, filters, raw);
            return ToolInvocationResult.success(target.name(), operation, raw,
                    Duration.ofNanos(System.nanoTime() - callStart));
        });
    }

    private ToolInvocationResult await(ToolSpec target,
                                       Operation operation,
                                       Future<ToolInvocationResult> future,
                                       long startNanos) {
        long deadline = startNanos + target.timeout().toNanos();
        try {
            return future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Registry] {} timed out after {}s on {}", target.name(),
                    target.timeout().toSeconds(), operation.wireName());
            return ToolInvocationResult.failure(target.name(), operation, AdapterErrorKind.TIMEOUT,
                    "no answer within %ds".formatted(target.timeout().toSeconds()), elapsed(startNanos));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            AdapterErrorKind kind = cause instanceof AdapterException adapterError
                    ? adapterError.kind() : AdapterErrorKind.BACKEND_ERROR;
            log.warn("[Registry] {} failed on {}: {} {}", target.name(), operation.wireName(),
                    kind, cause.getMessage());
            return ToolInvocationResult.failure(target.name(), operation, kind,
                    String.valueOf(cause.getMessage()), elapsed(startNanos));
        } catch (CancellationException e) {
            return ToolInvocationResult.failure(target.name(), operation, AdapterErrorKind.TIMEOUT,
                    "call was cancelled", elapsed(startNanos));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ToolInvocationResult.failure(target.name(), operation, AdapterErrorKind.TIMEOUT,
                    "dispatch was interrupted", elapsed(startNanos));
        }
    }

    private boolean isTaken(String identifier) {
        return tools.containsKey(identifier) || aliasIndex.containsKey(identifier);
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
