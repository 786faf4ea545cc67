package com.openforge.netagent.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.netagent.config.ConfigurationException;
import com.openforge.netagent.config.ToolProperties;
import lombok.extern.slf4j.Slf4j;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Monitoring adapter for the LibreNMS v0 API.
 *
 * Per-device endpoints (ports, health, links, oxidized) are called once per
 * device named in the {@code device} filter and concatenated. Every record
 * coming from a per-device endpoint is tagged with {@code hostname} so that
 * downstream mapping can attribute it.
 */
@Slf4j
public class LibreNmsAdapter implements NetworkToolAdapter {

    private static final String API = "api/v0/";

    private static final String SEVERITY_MAPPING = "alert-severity-mapping";

    private static final List<String> SEARCHABLE_FIELDS =
            List.of("hostname", "sysName", "ip", "location", "os", "hardware", "sysDescr");

    private final String            toolName;
    private final ToolProperties    config;
    private final RestBackendClient client;

    public LibreNmsAdapter(String toolName, ToolProperties config, RestBackendClient client) {
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
        return client.testConnection(API + "system");
    }

    @Override
    public JsonNode getDevices(Map<String, Object> filters) {
        List<String> devices = FilterValues.asList(filters, "device");
        if (!devices.isEmpty()) {
            ArrayNode merged = JsonNodeFactory.instance.arrayNode();
            for (String device : devices) {
                merged.addAll(array(client.get(API + "devices/" + segment(device), Map.of()), "devices"));
            }
            return merged;
        }

        Map<String, Object> params = new LinkedHashMap<>();
        FilterValues.first(filters, "status").ifPresent(status -> params.put("type", status));
        FilterValues.first(filters, "site").ifPresent(site -> {
            params.put("type", "location");
            params.put("query", site);
        });
        return array(client.get(API + "devices", params), "devices");
    }

    @Override
    public JsonNode getInterfaces(Map<String, Object> filters) {
        List<String> devices = FilterValues.asList(filters, "device");
        if (devices.isEmpty()) {
            return array(client.get(API + "ports", Map.of()), "ports");
        }
        return perDevice(devices, device -> "devices/" + segment(device) + "/ports", "ports");
    }

    @Override
    public JsonNode getAlerts(Map<String, Object> filters) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("state", FilterValues.first(filters, "state").orElse("1"));
        FilterValues.first(filters, "severity")
                .map(this::mapSeverity)
                .ifPresent(severity -> params.put("severity", severity));

        List<String> devices = FilterValues.asList(filters, "device");
        if (devices.isEmpty()) {
            return array(client.get(API + "alerts", params), "alerts");
        }
        ArrayNode merged = JsonNodeFactory.instance.arrayNode();
        for (String device : devices) {
            for (JsonNode alert : array(client.get(API + "devices/" + segment(device) + "/alerts", params), "alerts")) {
                if (alert instanceof ObjectNode object && !object.has("hostname")) {
                    object.put("hostname", device);
                }
                merged.add(alert);
            }
        }
        return merged;
    }

    @Override
    public JsonNode getMetrics(Map<String, Object> filters) {
        String suffix = FilterValues.first(filters, "metric").map(m -> "/health/" + segment(m)).orElse("/health");
        return perDevice(requireDevices(filters, Operation.GET_METRICS),
                device -> "devices/" + segment(device) + suffix, "graphs");
    }

    @Override
    public JsonNode getTopology(Map<String, Object> filters) {
        List<String> devices = FilterValues.asList(filters, "device");
        if (devices.isEmpty()) {
            return array(client.get(API + "resources/links", Map.of()), "links");
        }
        return perDevice(devices, device -> "devices/" + segment(device) + "/links", "links");
    }

    @Override
    public JsonNode getDeviceConfig(Map<String, Object> filters) {
        ArrayNode configs = JsonNodeFactory.instance.arrayNode();
        for (String device : requireDevices(filters, Operation.GET_DEVICE_CONFIG)) {
            JsonNode body = client.get(API + "devices/" + segment(device) + "/oxidized", Map.of());
            ObjectNode entry = JsonNodeFactory.instance.objectNode();
            entry.put("hostname", device);
            entry.set("config", body.path("config").isMissingNode() ? body : body.get("config"));
            configs.add(entry);
        }
        return configs;
    }

    @Override
    public JsonNode search(Map<String, Object> filters) {
        String needle = FilterValues.first(filters, "q").orElse("").toLowerCase(Locale.ROOT);
        ArrayNode hits = JsonNodeFactory.instance.arrayNode();
        for (JsonNode device : array(client.get(API + "devices", Map.of()), "devices")) {
            if (needle.isEmpty() || matches(device, needle)) hits.add(device);
        }
        log.debug("[LibreNMS:{}] search '{}' matched {} device(s)", toolName, needle, hits.size());
        return hits;
    }

    @Override
    public Set<Operation> supportedOperations() {
        return EnumSet.allOf(Operation.class);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private interface PathForDevice {
        String path(String device);
    }

    private ArrayNode perDevice(List<String> devices, PathForDevice pathFor, String field) {
        ArrayNode merged = JsonNodeFactory.instance.arrayNode();
        for (String device : devices) {
            for (JsonNode item : array(client.get(API + pathFor.path(device), Map.of()), field)) {
                if (item instanceof ObjectNode object && !object.has("hostname")) {
                    object.put("hostname", device);
                }
                merged.add(item);
            }
        }
        return merged;
    }

    private List<String> requireDevices(Map<String, Object> filters, Operation operation) {
        List<String> devices = FilterValues.asList(filters, "device");
        if (devices.isEmpty()) {
            throw new AdapterException(AdapterErrorKind.NOT_FOUND,
                    "%s needs a device filter for %s".formatted(toolName, operation.label()));
        }
        return devices;
    }

    @SuppressWarnings("unchecked")
    private String mapSeverity(String severity) {
        Object mapping = config.settings().get(SEVERITY_MAPPING);
        if (mapping instanceof Map<?, ?> table) {
            Object mapped = ((Map<String, Object>) table).get(severity.toLowerCase(Locale.ROOT));
            if (mapped != null) return String.valueOf(mapped);
        }
        return severity;
    }

    private static boolean matches(JsonNode device, String needle) {
        for (String field : SEARCHABLE_FIELDS) {
            JsonNode value = device.get(field);
            if (value != null && value.isValueNode()
                    && value.asText().toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static ArrayNode array(JsonNode body, String field) {
        JsonNode node = body.path(field);
        if (node.isArray()) return (ArrayNode) node;
        ArrayNode wrapped = JsonNodeFactory.instance.arrayNode();
        if (body.isArray()) {
            wrapped.addAll((ArrayNode) body);
        } else if (!node.isMissingNode() && !node.isNull()) {
            wrapped.add(node);
        }
        return wrapped;
    }

    private static String segment(String raw) {
        return URLEncoder.encode(raw, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
