package com.openforge.netagent.planner;

import java.util.List;

/**
 * No pattern matched and falling back to every tool is switched off.
 * The message suggests the {@code @alias} directives that would disambiguate.
 */
public class PlanningAmbiguousException extends RuntimeException {

    private final List<String> suggestedAliases;

    public PlanningAmbiguousException(String query, List<String> suggestedAliases) {
        super("Could not tell which tool should answer \"%s\". Prefix the query with one of: %s"
                .formatted(query, suggestedAliases.stream().map(a -> "@" + a).toList()));
        this.suggestedAliases = List.copyOf(suggestedAliases);
    }

    public List<String> suggestedAliases() {
        return suggestedAliases;
    }
}
