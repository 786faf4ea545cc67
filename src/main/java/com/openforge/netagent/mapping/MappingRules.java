package com.openforge.netagent.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field mapping rules for one tool: entity type → (standard field → dotted source path).
 *
 * Example for a NetBox device:
 *   name   → name
 *   status → status.value
 *   site   → site.name
 */
public record MappingRules(Map<String, Map<String, String>> entities) {

    private static final MappingRules EMPTY = new MappingRules(Map.of());

    public MappingRules {
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        if (entities != null) {
            entities.forEach((entity, fields) ->
                    copy.put(entity, Collections.unmodifiableMap(new LinkedHashMap<>(fields))));
        }
        entities = Collections.unmodifiableMap(copy);
    }

    public static MappingRules empty() {
        return EMPTY;
    }

    /** Ordered rules for the entity, or an empty map when none are configured. */
    public Map<String, String> fieldsFor(String entity) {
        return entities.getOrDefault(entity, Map.of());
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }
}
