package com.openforge.netagent.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.netagent.adapter.AdapterErrorKind;
import com.openforge.netagent.adapter.Operation;
import com.openforge.netagent.mapping.NormalizedRecord;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one operation against one tool. Exactly one of
 * ({@code raw}, {@code records}) or ({@code errorKind}, {@code errorMessage}) is meaningful,
 * depending on {@code success}. Records are empty until the loop normalizes the raw payload.
 */
public record ToolInvocationResult(
        String toolName,
        Operation operation,
        boolean success,
        JsonNode raw,
        List<NormalizedRecord> records,
        AdapterErrorKind errorKind,
        String errorMessage,
        Duration duration,
        boolean fromCache
) {

    public ToolInvocationResult {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public static ToolInvocationResult success(String toolName, Operation operation,
                                               JsonNode raw, Duration duration) {
        return new ToolInvocationResult(toolName, operation, true, raw, List.of(),
                null, null, duration, false);
    }

    public static ToolInvocationResult failure(String toolName, Operation operation,
                                               AdapterErrorKind kind, String message, Duration duration) {
        return new ToolInvocationResult(toolName, operation, false, null, List.of(),
                kind, message, duration, false);
    }

    public ToolInvocationResult withRecords(List<NormalizedRecord> normalized) {
        return new ToolInvocationResult(toolName, operation, success, raw, normalized,
                errorKind, errorMessage, duration, fromCache);
    }

    public ToolInvocationResult asCached() {
        return new ToolInvocationResult(toolName, operation, success, raw, records,
                errorKind, errorMessage, Duration.ZERO, true);
    }

    /** "librenms: TIMEOUT (no answer within 30s)" */
    public String describeFailure() {
        return "%s: %s (%s)".formatted(toolName, errorKind, errorMessage);
    }
}
