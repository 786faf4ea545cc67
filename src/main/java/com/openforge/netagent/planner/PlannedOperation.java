package com.openforge.netagent.planner;

import com.openforge.netagent.adapter.Operation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One (tool, operation, filters) step of a plan, with the tool already resolved
 * to its canonical name.
 */
public record PlannedOperation(
        String toolName,
        Operation operation,
        Map<String, Object> filters,
        String purpose
) {

    public PlannedOperation {
        filters = filters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
    }

    /** Same step with {@code extra} filters layered on top; {@code extra} wins on conflicts. */
    public PlannedOperation withFilters(Map<String, Object> extra) {
        if (extra == null || extra.isEmpty()) return this;
        Map<String, Object> merged = new LinkedHashMap<>(filters);
        merged.putAll(extra);
        return new PlannedOperation(toolName, operation, merged, purpose);
    }

    /** Same step with {@code defaults} added only where no filter is set yet. */
    public PlannedOperation withDefaultFilters(Map<String, Object> defaults) {
        if (defaults == null || defaults.isEmpty()) return this;
        Map<String, Object> merged = new LinkedHashMap<>(defaults);
        merged.putAll(filters);
        return new PlannedOperation(toolName, operation, merged, purpose);
    }
}
