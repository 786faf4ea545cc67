package com.openforge.netagent.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.netagent.adapter.Operation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short-lived cache of successful raw payloads keyed by (tool, operation, filters).
 * A zero TTL disables caching. Expired entries are dropped when looked up
 * and swept on every store, so the map never outlives one TTL of traffic.
 */
class ResultCache {

    private record Key(String tool, Operation operation, Map<String, Object> filters) {}

    private record Entry(JsonNode raw, Instant expiresAt) {}

    private final Map<Key, Entry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock    clock;

    ResultCache(Duration ttl, Clock clock) {
        this.ttl   = ttl;
        this.clock = clock;
    }

    Optional<JsonNode> get(String tool, Operation operation, Map<String, Object> filters) {
        if (!enabled()) return Optional.empty();
        Key key = new Key(tool, operation, new LinkedHashMap<>(filters));
        Entry entry = entries.get(key);
        if (entry == null) return Optional.empty();
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.raw());
    }

    void put(String tool, Operation operation, Map<String, Object> filters, JsonNode raw) {
        if (!enabled() || raw == null) return;
        Instant now = clock.instant();
        entries.values().removeIf(entry -> !now.isBefore(entry.expiresAt()));
        entries.put(new Key(tool, operation, new LinkedHashMap<>(filters)), new Entry(raw, now.plus(ttl)));
    }

    int size() {
        return entries.size();
    }

    void evictTool(String tool) {
        entries.keySet().removeIf(key -> key.tool().equals(tool));
    }

    private boolean enabled() {
        return ttl != null && !ttl.isZero() && !ttl.isNegative();
    }
}
