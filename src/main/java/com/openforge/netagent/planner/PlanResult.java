package com.openforge.netagent.planner;

import java.util.List;
import java.util.Map;

/**
 * What the planner decided for one query.
 *
 * @param immediate       operations to run now, in order
 * @param followUps       operations to run only after a primary succeeded
 * @param matchedPatterns names of the patterns that matched, in declaration order
 * @param explicitTool    canonical tool name when an {@code @alias} directive was used
 * @param operationQuery  query text with any directive stripped
 * @param extractedFilters filters read from the query text itself
 * @param fallback        true when no pattern matched and every enabled tool was targeted
 * @param weakMatch       true when neither a pattern nor a directive selected the tools
 */
public record PlanResult(
        List<PlannedOperation> immediate,
        List<PlannedOperation> followUps,
        List<String> matchedPatterns,
        String explicitTool,
        String operationQuery,
        Map<String, Object> extractedFilters,
        boolean fallback,
        boolean weakMatch
) {

    public PlanResult {
        immediate        = List.copyOf(immediate);
        followUps        = List.copyOf(followUps);
        matchedPatterns  = List.copyOf(matchedPatterns);
        extractedFilters = extractedFilters == null ? Map.of() : Map.copyOf(extractedFilters);
    }

    /** Tools targeted by the immediate operations, without duplicates, in order. */
    public List<String> targetTools() {
        return immediate.stream().map(PlannedOperation::toolName).distinct().toList();
    }
}
