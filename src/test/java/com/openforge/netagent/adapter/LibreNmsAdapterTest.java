package com.openforge.netagent.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.netagent.config.ToolProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LibreNmsAdapterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private RestBackendClient client;
    private LibreNmsAdapter adapter;

    @BeforeEach
    void setUp() {
        client = mock(RestBackendClient.class);
        ToolProperties config = ToolProperties.builder()
                .baseUrl("https://librenms.example.com")
                .apiToken("secret")
                .settings(Map.of("alert-severity-mapping", Map.of("major", "critical")))
                .build();
        adapter = new LibreNmsAdapter("librenms", config, client);
    }

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    @SuppressWarnings("unchecked")
    private static ArgumentCaptor<Map<String, Object>> paramsCaptor() {
        return ArgumentCaptor.forClass(Map.class);
    }

    @Test
    @DisplayName("Per-device ports are fetched per device and tagged with the hostname")
    void interfacesPerDevice() throws Exception {
        // Given
        when(client.get(eq("api/v0/devices/sw1/ports"), anyMap()))
                .thenReturn(json("{\"ports\": [{\"ifName\": \"eth0\"}]}"));
        when(client.get(eq("api/v0/devices/sw2/ports"), anyMap()))
                .thenReturn(json("{\"ports\": [{\"ifName\": \"eth1\"}, {\"ifName\": \"eth2\"}]}"));

        // When
        JsonNode ports = adapter.invoke(Operation.LIST_INTERFACES, Map.of("device", List.of("sw1", "sw2")));

        // Then
        assertThat(ports).hasSize(3);
        assertThat(ports.get(0).get("hostname").asText()).isEqualTo("sw1");
        assertThat(ports.get(2).get("hostname").asText()).isEqualTo("sw2");
    }

    @Test
    @DisplayName("Alerts default to active state and map severities through settings")
    void alertParameters() throws Exception {
        // Given
        when(client.get(eq("api/v0/alerts"), anyMap())).thenReturn(json("{\"alerts\": [{\"id\": 9}]}"));

        // When
        JsonNode alerts = adapter.getAlerts(Map.of("severity", "MAJOR"));

        // Then
        ArgumentCaptor<Map<String, Object>> params = paramsCaptor();
        verify(client).get(eq("api/v0/alerts"), params.capture());
        assertThat(params.getValue()).containsEntry("state", "1").containsEntry("severity", "critical");
        assertThat(alerts).hasSize(1);
    }

    @Test
    @DisplayName("A device filter narrows alerts to each device's own alert endpoint")
    void alertsPerDevice() throws Exception {
        // Given
        when(client.get(eq("api/v0/devices/sw1/alerts"), anyMap()))
                .thenReturn(json("{\"alerts\": [{\"id\": 1}]}"));
        when(client.get(eq("api/v0/devices/sw2/alerts"), anyMap()))
                .thenReturn(json("{\"alerts\": [{\"id\": 2, \"hostname\": \"sw2.lab\"}]}"));

        // When
        JsonNode alerts = adapter.invoke(Operation.LIST_ALERTS,
                Map.of("device", List.of("sw1", "sw2"), "severity", "major"));

        // Then
        assertThat(alerts).hasSize(2);
        assertThat(alerts.get(0).get("hostname").asText()).isEqualTo("sw1");
        assertThat(alerts.get(1).get("hostname").asText()).isEqualTo("sw2.lab");
        ArgumentCaptor<Map<String, Object>> params = paramsCaptor();
        verify(client).get(eq("api/v0/devices/sw1/alerts"), params.capture());
        assertThat(params.getValue()).containsEntry("severity", "critical");
        verify(client, never()).get(eq("api/v0/alerts"), anyMap());
    }

    @Test
    @DisplayName("Metrics need a device filter")
    void metricsNeedDevice() {
        assertThatThrownBy(() -> adapter.getMetrics(Map.of()))
                .isInstanceOf(AdapterException.class)
                .extracting(e -> ((AdapterException) e).kind())
                .isEqualTo(AdapterErrorKind.NOT_FOUND);
    }

    @Test
    @DisplayName("Device config wraps the oxidized body with the hostname")
    void deviceConfig() throws Exception {
        // Given
        when(client.get(eq("api/v0/devices/r1/oxidized"), anyMap()))
                .thenReturn(json("{\"status\": \"ok\", \"config\": \"hostname r1\"}"));

        // When
        JsonNode configs = adapter.getDeviceConfig(Map.of("device", "r1"));

        // Then
        assertThat(configs).singleElement().satisfies(entry -> {
            assertThat(entry.get("hostname").asText()).isEqualTo("r1");
            assertThat(entry.get("config").asText()).isEqualTo("hostname r1");
        });
    }

    @Test
    @DisplayName("Search filters the device list client-side, case-insensitively")
    void searchMatchesDeviceFields() throws Exception {
        // Given
        when(client.get(eq("api/v0/devices"), anyMap())).thenReturn(json("""
                {"devices": [
                  {"hostname": "core-sw01", "location": "DC-East"},
                  {"hostname": "edge-r1", "location": "Branch"}
                ]}
                """));

        // When
        JsonNode hits = adapter.search(Map.of("q", "dc-east"));

        // Then
        assertThat(hits).singleElement()
                .satisfies(hit -> assertThat(hit.get("hostname").asText()).isEqualTo("core-sw01"));
    }
}
