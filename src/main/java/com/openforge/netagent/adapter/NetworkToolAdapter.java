package com.openforge.netagent.adapter;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Set;

/**
 * Capability contract implemented once per backend tool.
 *
 * Every data operation takes an optional filter map (null or empty means
 * "no filtering") and returns the backend-native payload: either an array of
 * records or a single record. Failures are reported with {@link AdapterException}.
 *
 * Adapters hold no state across queries beyond their own connection settings.
 */
public interface NetworkToolAdapter {

    /**
     * Lightweight reachability and authentication probe.
     *
     * @return false on ordinary network or auth failure
     * @throws com.openforge.netagent.config.ConfigurationException if required settings are missing
     */
    boolean validateConnection();

    JsonNode getDevices(Map<String, Object> filters);

    JsonNode getInterfaces(Map<String, Object> filters);

    JsonNode getAlerts(Map<String, Object> filters);

    JsonNode getMetrics(Map<String, Object> filters);

    JsonNode getTopology(Map<String, Object> filters);

    JsonNode getDeviceConfig(Map<String, Object> filters);

    JsonNode search(Map<String, Object> filters);

    /** Operations this adapter can serve; others fail with {@code BACKEND_ERROR}. */
    Set<Operation> supportedOperations();

    default JsonNode invoke(Operation operation, Map<String, Object> filters) {
        Map<String, Object> safeFilters = filters == null ? Map.of() : filters;
        return switch (operation) {
            case LIST_DEVICES      -> getDevices(safeFilters);
            case LIST_INTERFACES   -> getInterfaces(safeFilters);
            case LIST_ALERTS       -> getAlerts(safeFilters);
            case GET_METRICS       -> getMetrics(safeFilters);
            case GET_TOPOLOGY      -> getTopology(safeFilters);
            case GET_DEVICE_CONFIG -> getDeviceConfig(safeFilters);
            case SEARCH            -> search(safeFilters);
        };
    }
}
