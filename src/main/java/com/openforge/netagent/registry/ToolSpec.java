package com.openforge.netagent.registry;

import com.openforge.netagent.adapter.NetworkToolAdapter;
import com.openforge.netagent.config.ToolProperties;
import com.openforge.netagent.mapping.MappingRules;

import java.time.Duration;
import java.util.List;

/**
 * A registered tool. Read-only once registered.
 *
 * @param name         canonical name, unique across names and aliases
 * @param aliases      alternative identifiers accepted by {@code resolve} and {@code @alias}
 * @param enabled      disabled tools stay resolvable but are never dispatched to
 * @param config       the tool's settings
 * @param mappingRules rules used to normalize this tool's records
 * @param adapter      live adapter owned by this tool
 * @param timeout      per-call deadline
 */
public record ToolSpec(
        String name,
        List<String> aliases,
        boolean enabled,
        ToolProperties config,
        MappingRules mappingRules,
        NetworkToolAdapter adapter,
        Duration timeout
) {

    public ToolSpec {
        aliases = List.copyOf(aliases);
        if (mappingRules == null) mappingRules = MappingRules.empty();
    }
}
