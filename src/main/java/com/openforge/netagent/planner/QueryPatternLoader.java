package com.openforge.netagent.planner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.openforge.netagent.adapter.Operation;
import com.openforge.netagent.config.ConfigurationException;
import com.openforge.netagent.config.ResourceLocations;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the pattern catalogue. Declaration order is preserved and is the
 * tie-break order when several patterns match.
 *
 * query_patterns:
 *   device_inventory:
 *     description: Devices by rack or site
 *     keywords: [device, rack, inventory]
 *     primary:
 *       - tool: netbox
 *         operation: list_devices
 *         purpose: Device inventory
 *     secondary:
 *       - tool: librenms
 *         operation: list_alerts
 */
@Slf4j
public final class QueryPatternLoader {

    private static final YAMLMapper YAML = new YAMLMapper();

    private QueryPatternLoader() {}

    public static List<QueryPattern> load(String location) {
        try (InputStream in = ResourceLocations.open(location)) {
            List<QueryPattern> patterns = parse(YAML.readTree(in));
            log.info("[Planner] Loaded {} query pattern(s) from {}", patterns.size(), location);
            return patterns;
        } catch (IOException e) {
            throw new ConfigurationException("Invalid pattern file " + location + ": " + e.getMessage(), e);
        }
    }

    static List<QueryPattern> parse(JsonNode root) {
        JsonNode catalogue = root == null ? null : root.path("query_patterns");
        if (catalogue == null || !catalogue.isObject()) {
            throw new ConfigurationException("Pattern file must contain a 'query_patterns' map");
        }
        List<QueryPattern> patterns = new ArrayList<>();
        catalogue.fields().forEachRemaining(entry -> {
            JsonNode node = entry.getValue();
            List<String> keywords = new ArrayList<>();
            node.path("keywords").forEach(k -> keywords.add(k.asText()));
            if (keywords.isEmpty()) {
                throw new ConfigurationException("Pattern '%s' has no keywords".formatted(entry.getKey()));
            }
            patterns.add(new QueryPattern(
                    entry.getKey(),
                    node.path("description").asText(null),
                    keywords,
                    descriptors(entry.getKey(), node.path("primary")),
                    descriptors(entry.getKey(), node.path("secondary"))));
        });
        return patterns;
    }

    private static List<EndpointDescriptor> descriptors(String pattern, JsonNode list) {
        List<EndpointDescriptor> descriptors = new ArrayList<>();
        for (JsonNode node : list) {
            String tool = node.path("tool").asText(null);
            String operation = node.path("operation").asText(null);
            if (tool == null || operation == null) {
                throw new ConfigurationException(
                        "Pattern '%s' has an endpoint without tool or operation".formatted(pattern));
            }
            Operation op;
            try {
                op = Operation.fromName(operation);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Pattern '%s': %s".formatted(pattern, e.getMessage()), e);
            }
            Map<String, Object> filters = new LinkedHashMap<>();
            node.path("filters").fields().forEachRemaining(f -> filters.put(f.getKey(),
                    f.getValue().isArray() ? toList(f.getValue()) : f.getValue().asText()));
            descriptors.add(new EndpointDescriptor(tool, op, filters, node.path("purpose").asText(null)));
        }
        return descriptors;
    }

    private static List<String> toList(JsonNode array) {
        List<String> values = new ArrayList<>();
        array.forEach(v -> values.add(v.asText()));
        return values;
    }
}
