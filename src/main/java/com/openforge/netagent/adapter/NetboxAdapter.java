package com.openforge.netagent.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.netagent.config.ConfigurationException;
import com.openforge.netagent.config.ToolProperties;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Inventory (source of truth) adapter for the NetBox REST API.
 *
 * NetBox pages list endpoints as {"count": n, "results": [...]}; the adapter
 * returns the {@code results} array. Metrics and device configuration are not
 * kept in NetBox and fail as unsupported.
 */
public class NetboxAdapter implements NetworkToolAdapter {

    private static final int DEFAULT_PAGE_SIZE = 1000;

    private final String            toolName;
    private final ToolProperties    config;
    private final RestBackendClient client;

    public NetboxAdapter(String toolName, ToolProperties config, RestBackendClient client) {
        this.toolName = toolName;
        this.config   = config;
        this.client   = client;
    }

    @Override
    public boolean validateConnection() {
        if (!config.hasCredentials()) {
            throw new ConfigurationException(
                    "Tool '%s' needs base-url and api-token".formatted(toolName));
        }
        return client.testConnection("api/status/");
    }

    @Override
    public JsonNode getDevices(Map<String, Object> filters) {
        Map<String, Object> params = pagedParams(filters);
        // "device" in the common vocabulary is the device name
        Object device = params.remove("device");
        if (device != null) params.put("name", device);
        return results(client.get("api/dcim/devices/", params));
    }

    @Override
    public JsonNode getInterfaces(Map<String, Object> filters) {
        return results(client.get("api/dcim/interfaces/", pagedParams(filters)));
    }

    @Override
    public JsonNode getAlerts(Map<String, Object> filters) {
        Map<String, Object> params = pagedParams(filters);
        Object severity = params.remove("severity");
        if (severity != null) params.put("priority", severity);
        return results(client.get("api/extras/events/", params));
    }

    @Override
    public JsonNode getMetrics(Map<String, Object> filters) {
        throw AdapterException.unsupported(toolName, Operation.GET_METRICS);
    }

    @Override
    public JsonNode getTopology(Map<String, Object> filters) {
        return results(client.get("api/dcim/cables/", pagedParams(filters)));
    }

    @Override
    public JsonNode getDeviceConfig(Map<String, Object> filters) {
        throw AdapterException.unsupported(toolName, Operation.GET_DEVICE_CONFIG);
    }

    @Override
    public JsonNode search(Map<String, Object> filters) {
        String query = FilterValues.first(filters, "q").orElse("");
        return results(client.get("api/extras/search/", Map.of("q", query)));
    }

    @Override
    public Set<Operation> supportedOperations() {
        return EnumSet.of(Operation.LIST_DEVICES, Operation.LIST_INTERFACES, Operation.LIST_ALERTS,
                Operation.GET_TOPOLOGY, Operation.SEARCH);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private Map<String, Object> pagedParams(Map<String, Object> filters) {
        Map<String, Object> params = new LinkedHashMap<>();
        if (filters != null) {
            filters.forEach((key, value) -> {
                if (value != null) params.put(key, value);
            });
        }
        params.putIfAbsent("limit", config.settings().getOrDefault("page-size", DEFAULT_PAGE_SIZE));
        return params;
    }

    private static JsonNode results(JsonNode body) {
        JsonNode results = body.path("results");
        return results.isMissingNode() ? body : results;
    }
}
