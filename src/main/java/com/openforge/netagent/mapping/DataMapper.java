package com.openforge.netagent.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates backend-native records into {@link NormalizedRecord}s.
 *
 * Each rule is a dotted path into the raw record; integer segments index
 * arrays ("ip_addresses.0.address"). A path that does not resolve yields
 * null for that field and never fails the record.
 *
 * Stateless and side-effect free: mapping the same raw input twice gives
 * equal results.
 */
public class DataMapper {

    // plain mapper: values are converted as-is, no naming strategy
    private static final ObjectMapper CONVERTER = new ObjectMapper();

    private final boolean standardize;

    public DataMapper(boolean standardize) {
        this.standardize = standardize;
    }

    /**
     * Maps a raw response: an array yields one record per element, any other
     * node yields a single record. Missing or null payloads yield no records.
     */
    public List<NormalizedRecord> normalize(String toolName, String entity,
                                            MappingRules rules, JsonNode raw) {
        if (raw == null || raw.isMissingNode() || raw.isNull()) return List.of();

        Map<String, String> fieldRules = rules == null ? Map.of() : rules.fieldsFor(entity);
        List<NormalizedRecord> records = new ArrayList<>();
        if (raw.isArray()) {
            for (JsonNode item : raw) {
                records.add(map(toolName, fieldRules, item));
            }
        } else {
            records.add(map(toolName, fieldRules, raw));
        }
        return records;
    }

    /**
     * Maps one raw record. Without rules (or with standardization switched off)
     * the record's top-level fields pass through unchanged.
     */
    public NormalizedRecord map(String toolName, Map<String, String> fieldRules, JsonNode record) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (!standardize || fieldRules == null || fieldRules.isEmpty()) {
            if (record != null && record.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> it = record.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> entry = it.next();
                    fields.put(entry.getKey(), toJava(entry.getValue()));
                }
            } else {
                fields.put("value", toJava(record));
            }
            return new NormalizedRecord(toolName, fields);
        }

        fieldRules.forEach((standardField, path) ->
                fields.put(standardField, toJava(resolve(record, path))));
        return new NormalizedRecord(toolName, fields);
    }

    /** Walks a dotted path; returns null as soon as a segment is absent. */
    static JsonNode resolve(JsonNode record, String path) {
        if (record == null || path == null || path.isBlank()) return null;
        JsonNode current = record;
        for (String segment : path.split("\\.")) {
            if (current == null || current.isNull() || current.isMissingNode()) return null;
            if (current.isArray()) {
                current = isIndex(segment) ? current.get(Integer.parseInt(segment)) : null;
            } else if (current.isObject()) {
                current = current.get(segment);
            } else {
                return null;
            }
        }
        return current;
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) return false;
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) return false;
        }
        return true;
    }

    private static Object toJava(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        return CONVERTER.convertValue(node, Object.class);
    }
}
