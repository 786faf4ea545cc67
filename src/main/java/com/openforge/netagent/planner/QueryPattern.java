package com.openforge.netagent.planner;

import java.util.List;
import java.util.Locale;

/**
 * A declarative rule: any keyword contained in a query selects the pattern's
 * primary endpoints, and its secondary endpoints run as follow-ups.
 */
public record QueryPattern(
        String name,
        String description,
        List<String> keywords,
        List<EndpointDescriptor> primary,
        List<EndpointDescriptor> secondary
) {

    public QueryPattern {
        keywords  = keywords == null ? List.of()
                : keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
        primary   = primary   == null ? List.of() : List.copyOf(primary);
        secondary = secondary == null ? List.of() : List.copyOf(secondary);
    }
}
