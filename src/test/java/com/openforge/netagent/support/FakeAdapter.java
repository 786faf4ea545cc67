package com.openforge.netagent.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.netagent.adapter.AdapterErrorKind;
import com.openforge.netagent.adapter.AdapterException;
import com.openforge.netagent.adapter.NetworkToolAdapter;
import com.openforge.netagent.adapter.Operation;

import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * In-memory adapter: canned payloads per operation, optional failures and delay.
 * Every call is recorded.
 */
public class FakeAdapter implements NetworkToolAdapter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public record Call(Operation operation, Map<String, Object> filters) {}

    private final Map<Operation, Function<Map<String, Object>, JsonNode>> responses = new EnumMap<>(Operation.class);
    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private volatile Duration delay = Duration.ZERO;

    public FakeAdapter respond(Operation operation, String json) {
        JsonNode payload = json(json);
        responses.put(operation, filters -> payload);
        return this;
    }

    public FakeAdapter respond(Operation operation, Function<Map<String, Object>, JsonNode> response) {
        responses.put(operation, response);
        return this;
    }

    public FakeAdapter fail(Operation operation, AdapterErrorKind kind, String message) {
        responses.put(operation, filters -> {
            throw new AdapterException(kind, message);
        });
        return this;
    }

    public FakeAdapter delay(Duration delay) {
        this.delay = delay;
        return this;
    }

    public List<Call> calls() {
        return calls;
    }

    public static JsonNode json(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    @Override
    public boolean validateConnection() {
        return true;
    }

    @Override
    public JsonNode getDevices(Map<String, Object> filters) {
        return answer(Operation.LIST_DEVICES, filters);
    }

    @Override
    public JsonNode getInterfaces(Map<String, Object> filters) {
        return answer(Operation.LIST_INTERFACES, filters);
    }

    @Override
    public JsonNode getAlerts(Map<String, Object> filters) {
        return answer(Operation.LIST_ALERTS, filters);
    }

    @Override
    public JsonNode getMetrics(Map<String, Object> filters) {
        return answer(Operation.GET_METRICS, filters);
    }

    @Override
    public JsonNode getTopology(Map<String, Object> filters) {
        return answer(Operation.GET_TOPOLOGY, filters);
    }

    @Override
    public JsonNode getDeviceConfig(Map<String, Object> filters) {
        return answer(Operation.GET_DEVICE_CONFIG, filters);
    }

    @Override
    public JsonNode search(Map<String, Object> filters) {
        return answer(Operation.SEARCH, filters);
    }

    @Override
    public Set<Operation> supportedOperations() {
        return responses.isEmpty() ? EnumSet.noneOf(Operation.class) : EnumSet.copyOf(responses.keySet());
    }

    private JsonNode answer(Operation operation, Map<String, Object> filters) {
        calls.add(new Call(operation, Map.copyOf(filters)));
        if (!delay.isZero()) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AdapterException(AdapterErrorKind.TIMEOUT, "interrupted");
            }
        }
        Function<Map<String, Object>, JsonNode> response = responses.get(operation);
        if (response == null) {
            throw AdapterException.unsupported("fake", operation);
        }
        return response.apply(filters);
    }
}
