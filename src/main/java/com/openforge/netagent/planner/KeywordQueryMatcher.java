package com.openforge.netagent.planner;

import java.util.List;
import java.util.Locale;

/**
 * A pattern matches when at least one of its keywords is a substring of the
 * lower-cased query. Plain containment: "port" also matches "report".
 */
public class KeywordQueryMatcher implements QueryMatcher {

    @Override
    public List<QueryPattern> match(String queryText, List<QueryPattern> patterns) {
        if (queryText == null || queryText.isBlank()) return List.of();
        String lowered = queryText.toLowerCase(Locale.ROOT);
        return patterns.stream()
                .filter(pattern -> pattern.keywords().stream()
                        .anyMatch(keyword -> !keyword.isEmpty() && lowered.contains(keyword)))
                .toList();
    }
}
