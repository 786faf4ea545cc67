package com.openforge.netagent.adapter;

import com.openforge.netagent.config.ToolProperties;

/**
 * Builds a live adapter from a tool's configuration.
 * Passed to {@code ToolRegistry.register} so tools can be added at runtime.
 */
@FunctionalInterface
public interface AdapterFactory {

    NetworkToolAdapter create(String toolName, ToolProperties config);
}
