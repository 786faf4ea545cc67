package com.openforge.netagent.adapter;

import java.util.Arrays;
import java.util.Locale;

/**
 * The backend-agnostic operation set every adapter is addressed through.
 *
 * Each operation names the entity type its records describe; the data mapper
 * selects mapping rules by that entity.
 */
public enum Operation {

    LIST_DEVICES("list_devices", "list devices", "device"),
    LIST_INTERFACES("list_interfaces", "list interfaces", "interface"),
    LIST_ALERTS("list_alerts", "list alerts", "alert"),
    GET_METRICS("get_metrics", "get metrics", "metric"),
    GET_TOPOLOGY("get_topology", "get topology", "link"),
    GET_DEVICE_CONFIG("get_device_config", "get device config", "config"),
    SEARCH("search", "search", "search_result");

    private final String wireName;
    private final String label;
    private final String entity;

    Operation(String wireName, String label, String entity) {
        this.wireName = wireName;
        this.label    = label;
        this.entity   = entity;
    }

    /** Name used in pattern files and in LLM tool-call arguments. */
    public String wireName() {
        return wireName;
    }

    /** Human-readable form, e.g. "list devices". */
    public String label() {
        return label;
    }

    public String entity() {
        return entity;
    }

    /**
     * Accepts the wire name ("list_devices"), the label ("list devices")
     * or the enum constant name, case-insensitively.
     */
    public static Operation fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Operation name must not be blank");
        }
        String normalized = name.strip().toLowerCase(Locale.ROOT).replace(' ', '_');
        return Arrays.stream(values())
                .filter(op -> op.wireName.equals(normalized)
                        || op.name().toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown operation: " + name));
    }

    /**
     * Best-effort operation for free text that matched no pattern.
     * Checked in order: alerts, metrics, interfaces, topology, config, devices;
     * anything else becomes a search.
     */
    public static Operation infer(String text) {
        if (text == null) return SEARCH;
        String q = text.toLowerCase(Locale.ROOT);
        if (containsAny(q, "alert", "alarm", "event"))                      return LIST_ALERTS;
        if (containsAny(q, "metric", "performance", "utilization", "cpu",
                "memory", "health", "latency"))                             return GET_METRICS;
        if (containsAny(q, "interface", "port"))                            return LIST_INTERFACES;
        if (containsAny(q, "topology", "link", "cable", "neighbor",
                "neighbour", "connected"))                                  return GET_TOPOLOGY;
        if (containsAny(q, "config", "configuration", "running-config"))    return GET_DEVICE_CONFIG;
        if (containsAny(q, "device", "switch", "router", "host",
                "inventory", "rack", "site"))                               return LIST_DEVICES;
        return SEARCH;
    }

    private static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) return true;
        }
        return false;
    }
}
