package com.openforge.netagent.planner;

import com.openforge.netagent.adapter.Operation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds a pattern to one backend operation.
 *
 * @param tool      tool name or alias the operation runs against
 * @param operation operation to invoke
 * @param filters   fixed filters contributed by the pattern
 * @param purpose   human-readable reason, shown to the LLM
 */
public record EndpointDescriptor(
        String tool,
        Operation operation,
        Map<String, Object> filters,
        String purpose
) {

    public EndpointDescriptor {
        filters = filters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
        if (purpose == null) purpose = operation.label();
    }
}
