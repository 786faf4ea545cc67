package com.openforge.netagent.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.netagent.adapter.Operation;
import com.openforge.netagent.registry.ToolSpec;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record ToolView(String name, List<String> aliases, boolean enabled,
                       List<String> operations, long timeoutSeconds) {

    public static ToolView from(ToolSpec spec) {
        return new ToolView(spec.name(), spec.aliases(), spec.enabled(),
                spec.adapter().supportedOperations().stream().map(Operation::wireName).sorted().toList(),
                spec.timeout().toSeconds());
    }
}
