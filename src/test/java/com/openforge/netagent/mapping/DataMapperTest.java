package com.openforge.netagent.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DataMapperTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final MappingRules NETBOX = new MappingRules(Map.of(
            "device", Map.of(
                    "name", "name",
                    "status", "status.value",
                    "site", "site.name",
                    "ip", "primary_ip4.address"),
            "link", Map.of(
                    "a_device", "a_terminations.0.object.device.name")));

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    @Test
    @DisplayName("Nested paths are resolved into standard fields; absent paths become null")
    void mapsNestedPaths() throws Exception {
        // Given
        JsonNode raw = json("""
                [{"name": "sw1", "status": {"value": "active"}, "site": {"name": "dc1"}, "primary_ip4": null},
                 {"name": "sw2", "status": {"value": "offline"}}]
                """);

        // When
        List<NormalizedRecord> records = new DataMapper(true).normalize("netbox", "device", NETBOX, raw);

        // Then
        assertThat(records).hasSize(2);
        assertThat(records.get(0).fields())
                .containsEntry("name", "sw1")
                .containsEntry("status", "active")
                .containsEntry("site", "dc1")
                .containsEntry("ip", null);
        assertThat(records.get(1).text("site")).isNull();
        assertThat(records).allSatisfy(r -> assertThat(r.toolName()).isEqualTo("netbox"));
    }

    @Test
    @DisplayName("Numeric segments index into arrays")
    void indexesArrays() throws Exception {
        // Given
        JsonNode cable = json("""
                {"a_terminations": [{"object": {"device": {"name": "core-1"}}}]}
                """);

        // When
        List<NormalizedRecord> records = new DataMapper(true).normalize("netbox", "link", NETBOX, cable);

        // Then
        assertThat(records).singleElement()
                .satisfies(r -> assertThat(r.get("a_device")).isEqualTo("core-1"));
        assertThat(DataMapper.resolve(cable, "a_terminations.3.object")).isNull();
        assertThat(DataMapper.resolve(cable, "a_terminations.x")).isNull();
    }

    @Test
    @DisplayName("Without rules, or with standardization off, records pass through")
    void passThrough() throws Exception {
        // Given
        JsonNode raw = json("[{\"hostname\": \"r1\", \"uptime\": 42}]");

        // When
        NormalizedRecord noRules = new DataMapper(true).normalize("librenms", "device", MappingRules.empty(), raw).get(0);
        NormalizedRecord disabled = new DataMapper(false).normalize("netbox", "device", NETBOX,
                json("{\"name\": \"sw1\", \"status\": {\"value\": \"active\"}}")).get(0);

        // Then
        assertThat(noRules.fields()).containsEntry("hostname", "r1").containsEntry("uptime", 42);
        assertThat(disabled.get("status")).isEqualTo(Map.of("value", "active"));
    }

    @Test
    @DisplayName("Missing payloads produce no records; scalars are wrapped as 'value'")
    void edgePayloads() throws Exception {
        DataMapper mapper = new DataMapper(true);

        assertThat(mapper.normalize("netbox", "device", NETBOX, null)).isEmpty();
        assertThat(mapper.normalize("netbox", "device", NETBOX, json("null"))).isEmpty();
        assertThat(mapper.normalize("netbox", "device", NETBOX, json("[]"))).isEmpty();
        assertThat(mapper.normalize("librenms", "metric", MappingRules.empty(), json("[7]")))
                .singleElement().satisfies(r -> assertThat(r.get("value")).isEqualTo(7));
    }

    @Test
    @DisplayName("Mapping the same payload twice gives equal records and leaves the payload untouched")
    void normalizationIsIdempotent() throws Exception {
        // Given
        MappingRules rules = MappingRulesLoader.load("classpath:mappings/netbox.yml");
        JsonNode raw = json("""
                [{"name": "sw1", "status": {"value": "active"}, "device_type": {"model": "C9300"},
                  "primary_ip4": {"address": "10.0.0.1/24"}},
                 {"name": "sw2", "rack": null},
                 {"serial": 42}]
                """);
        JsonNode snapshot = raw.deepCopy();
        DataMapper mapper = new DataMapper(true);

        // When
        List<NormalizedRecord> first = mapper.normalize("netbox", "device", rules, raw);
        List<NormalizedRecord> second = mapper.normalize("netbox", "device", rules, raw);

        // Then
        assertThat(second).isEqualTo(first);
        assertThat(raw).isEqualTo(snapshot);
        assertThat(first.get(0).fields())
                .containsEntry("model", "C9300")
                .containsEntry("manufacturer", null)
                .containsEntry("ip", "10.0.0.1/24");
        assertThat(first.get(1).fields()).containsEntry("rack", null).containsEntry("site", null);
        assertThat(first.get(2).fields()).containsEntry("name", null).containsEntry("serial", 42);
    }

    @Test
    @DisplayName("Shipped mapping files load with and without the standard_fields level")
    void loadsMappingFiles() throws Exception {
        // When
        MappingRules netbox = MappingRulesLoader.load("classpath:mappings/netbox.yml");
        MappingRules flat = MappingRulesLoader.parse(new YAMLMapper()
                .readTree("device:\n  name: hostname\n"));

        // Then
        assertThat(netbox.fieldsFor("device")).containsEntry("status", "status.value");
        assertThat(netbox.fieldsFor("unknown")).isEmpty();
        assertThat(flat.fieldsFor("device")).containsEntry("name", "hostname");
    }
}
