package com.openforge.netagent.adapter;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads filter values that may arrive either as a single value or as a list
 * (context-derived device sets are lists).
 */
public final class FilterValues {

    private FilterValues() {}

    public static List<String> asList(Map<String, Object> filters, String key) {
        if (filters == null) return List.of();
        Object value = filters.get(key);
        if (value == null) return List.of();
        if (value instanceof Collection<?> values) {
            return values.stream()
                    .filter(v -> v != null && !String.valueOf(v).isBlank())
                    .map(String::valueOf)
                    .toList();
        }
        String single = String.valueOf(value);
        return single.isBlank() ? List.of() : List.of(single);
    }

    public static Optional<String> first(Map<String, Object> filters, String key) {
        return asList(filters, key).stream().findFirst();
    }
}
