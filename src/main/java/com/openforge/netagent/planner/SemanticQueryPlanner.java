package com.openforge.netagent.planner;

import com.openforge.netagent.adapter.Operation;
import com.openforge.netagent.config.AgentProperties;
import com.openforge.netagent.registry.ToolRegistry;
import com.openforge.netagent.registry.ToolSpec;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a natural-language query to backend operations.
 *
 * Resolution order:
 *   1. {@code @alias rest} targets exactly that tool; keyword patterns are not consulted
 *      and the operation is inferred from the rest of the text.
 *   2. Keyword patterns: primaries from the first match (from all matches when
 *      aggregate-matches is on); follow-ups from the secondaries of all matches.
 *   3. Nothing matched: every enabled tool with an inferred operation when
 *      query-all-enabled is on, otherwise {@link PlanningAmbiguousException}.
 *
 * Filters read from the query text override filters fixed by a pattern.
 */
@Slf4j
public class SemanticQueryPlanner {

    private static final Pattern ALIAS_DIRECTIVE = Pattern.compile("^@(\\S+)\\s*(.*)$", Pattern.DOTALL);

    private final ToolRegistry             registry;
    private final List<QueryPattern>       patterns;
    private final QueryMatcher             matcher;
    private final FilterExtractor          extractor;
    private final AgentProperties.Settings settings;

    public SemanticQueryPlanner(ToolRegistry registry,
                                List<QueryPattern> patterns,
                                QueryMatcher matcher,
                                FilterExtractor extractor,
                                AgentProperties.Settings settings) {
        this.registry  = registry;
        this.patterns  = List.copyOf(patterns);
        this.matcher   = matcher;
        this.extractor = extractor;
        this.settings  = settings;
    }

    public PlanResult plan(String queryText) {
        if (queryText == null || queryText.isBlank()) {
            throw new IllegalArgumentException("Query must not be blank");
        }
        String text = queryText.strip();
        Matcher directive = ALIAS_DIRECTIVE.matcher(text);
        PlanResult plan = directive.matches()
                ? planExplicit(directive.group(1), directive.group(2).strip())
                : planByPatterns(text);

        log.info("[Planner] \"{}\" → {} immediate, {} follow-up, patterns={}, explicit={}, fallback={}",
                text, plan.immediate().size(), plan.followUps().size(), plan.matchedPatterns(),
                plan.explicitTool(), plan.fallback());
        return plan;
    }

    public List<QueryPattern> patterns() {
        return patterns;
    }

    // ── Strategies ───────────────────────────────────────────────────────────

    private PlanResult planExplicit(String alias, String rest) {
        ToolSpec tool = registry.resolve(alias);
        Map<String, Object> extracted = extractor.extract(rest);
        Operation operation = patternOperationFor(tool, rest).orElseGet(() -> Operation.infer(rest));

        PlannedOperation step = new PlannedOperation(tool.name(), operation,
                withSearchTerm(operation, extracted, rest), "explicit @" + alias);
        return new PlanResult(List.of(step), List.of(), List.of(), tool.name(), rest,
                extracted, false, false);
    }

    private PlanResult planByPatterns(String text) {
        List<QueryPattern> matches = matcher.match(text, patterns);
        List<String> matchedNames = matches.stream().map(QueryPattern::name).toList();
        Map<String, Object> extracted = extractor.extract(text);

        if (!matches.isEmpty()) {
            // without aggregation the first pattern with a usable primary wins
            List<PlannedOperation> immediate = new ArrayList<>();
            for (QueryPattern pattern : matches) {
                for (EndpointDescriptor descriptor : pattern.primary()) {
                    toOperation(pattern, descriptor)
                            .map(op -> op.withFilters(extracted))
                            .map(op -> op.withFilters(withSearchTerm(op.operation(), op.filters(), text)))
                            .ifPresent(immediate::add);
                }
                if (!immediate.isEmpty() && !settings.aggregateMatches()) break;
            }

            List<PlannedOperation> followUps = new ArrayList<>();
            for (QueryPattern pattern : matches) {
                for (EndpointDescriptor descriptor : pattern.secondary()) {
                    toOperation(pattern, descriptor).ifPresent(followUps::add);
                }
            }

            if (!immediate.isEmpty()) {
                List<PlannedOperation> distinctImmediate = distinct(immediate);
                List<PlannedOperation> distinctFollowUps = distinct(followUps);
                distinctFollowUps.removeIf(followUp -> distinctImmediate.stream().anyMatch(op ->
                        op.toolName().equals(followUp.toolName()) && op.operation() == followUp.operation()));
                return new PlanResult(distinctImmediate, distinctFollowUps, matchedNames, null, text,
                        extracted, false, false);
            }
            log.warn("[Planner] Patterns {} matched but none of their tools is available", matchedNames);
        }

        if (!settings.queryAllEnabled()) {
            throw new PlanningAmbiguousException(text, aliasSuggestions());
        }

        Operation operation = Operation.infer(text);
        List<PlannedOperation> everyTool = registry.enabledTools().stream()
                .map(tool -> new PlannedOperation(tool.name(), operation,
                        withSearchTerm(operation, extracted, text), "best-effort " + operation.label()))
                .toList();
        return new PlanResult(everyTool, List.of(), matchedNames, null, text, extracted, true, true);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /** Operation of the first matching pattern's primary descriptor bound to {@code tool}. */
    private Optional<Operation> patternOperationFor(ToolSpec tool, String text) {
        for (QueryPattern pattern : matcher.match(text, patterns)) {
            for (EndpointDescriptor descriptor : pattern.primary()) {
                boolean boundToTool = registry.find(descriptor.tool())
                        .map(spec -> spec.name().equals(tool.name()))
                        .orElse(false);
                if (boundToTool) return Optional.of(descriptor.operation());
            }
        }
        return Optional.empty();
    }

    private Optional<PlannedOperation> toOperation(QueryPattern pattern, EndpointDescriptor descriptor) {
        Optional<ToolSpec> tool = registry.find(descriptor.tool());
        if (tool.isEmpty()) {
            log.warn("[Planner] Pattern '{}' names unknown tool '{}', skipped", pattern.name(), descriptor.tool());
            return Optional.empty();
        }
        if (!tool.get().enabled()) {
            log.debug("[Planner] Pattern '{}' names disabled tool '{}', skipped", pattern.name(), descriptor.tool());
            return Optional.empty();
        }
        return Optional.of(new PlannedOperation(tool.get().name(), descriptor.operation(),
                descriptor.filters(), descriptor.purpose()));
    }

    private static Map<String, Object> withSearchTerm(Operation operation, Map<String, Object> filters, String text) {
        Map<String, Object> result = new LinkedHashMap<>(filters);
        if (operation == Operation.SEARCH && !text.isBlank()) {
            result.putIfAbsent("q", text);
        }
        return result;
    }

    private static List<PlannedOperation> distinct(List<PlannedOperation> operations) {
        return new ArrayList<>(new LinkedHashSet<>(operations));
    }

    private List<String> aliasSuggestions() {
        return registry.enabledTools().stream()
                .map(tool -> tool.aliases().isEmpty() ? tool.name() : tool.aliases().get(0))
                .toList();
    }
}
