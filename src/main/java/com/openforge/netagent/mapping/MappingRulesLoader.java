package com.openforge.netagent.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.openforge.netagent.config.ConfigurationException;
import com.openforge.netagent.config.ResourceLocations;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads a per-tool mapping file:
 *
 * device:
 *   standard_fields:
 *     name: name
 *     status: status.value
 * interface:
 *   standard_fields:
 *     device: device.name
 *
 * The {@code standard_fields} level is optional.
 */
@Slf4j
public final class MappingRulesLoader {

    private static final YAMLMapper YAML = new YAMLMapper();

    private MappingRulesLoader() {}

    public static MappingRules load(String location) {
        if (location == null || location.isBlank()) return MappingRules.empty();
        try (InputStream in = ResourceLocations.open(location)) {
            MappingRules rules = parse(YAML.readTree(in));
            log.debug("[Mapping] Loaded rules for {} entity type(s) from {}", rules.entities().size(), location);
            return rules;
        } catch (IOException e) {
            throw new ConfigurationException("Invalid mapping file " + location + ": " + e.getMessage(), e);
        }
    }

    static MappingRules parse(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) return MappingRules.empty();
        if (!root.isObject()) {
            throw new ConfigurationException("Mapping file must be a map of entity types");
        }
        Map<String, Map<String, String>> entities = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entity = it.next();
            JsonNode fieldsNode = entity.getValue().has("standard_fields")
                    ? entity.getValue().get("standard_fields")
                    : entity.getValue();
            Map<String, String> fields = new LinkedHashMap<>();
            fieldsNode.fields().forEachRemaining(field -> fields.put(field.getKey(), field.getValue().asText()));
            entities.put(entity.getKey(), fields);
        }
        return new MappingRules(entities);
    }
}
