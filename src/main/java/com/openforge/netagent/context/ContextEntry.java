package com.openforge.netagent.context;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What one query resolved: the tools that answered and the entities their
 * records named, e.g. {device: [sw-01, sw-02]}.
 */
public record ContextEntry(
        String query,
        List<String> tools,
        Map<String, List<String>> entities,
        Instant timestamp
) {

    public ContextEntry {
        tools = List.copyOf(tools);
        Map<String, List<String>> copy = new LinkedHashMap<>();
        entities.forEach((type, ids) -> copy.put(type, List.copyOf(ids)));
        entities = Collections.unmodifiableMap(copy);
    }

    public boolean hasEntities() {
        return entities.values().stream().anyMatch(ids -> !ids.isEmpty());
    }
}
