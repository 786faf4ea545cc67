package com.openforge.netagent.context;

import com.openforge.netagent.adapter.Operation;
import com.openforge.netagent.mapping.NormalizedRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads device identifiers out of normalized records: the {@code name} of
 * device records, the {@code device} field of everything else.
 */
public final class EntityExtractor {

    public static final String DEVICE = "device";

    private static final List<String> DEVICE_NAME_FIELDS = List.of("name", "hostname", "id");
    private static final List<String> OWNER_FIELDS       = List.of("device", "hostname");

    private EntityExtractor() {}

    public static Map<String, List<String>> extract(Operation operation, List<NormalizedRecord> records) {
        Set<String> devices = new LinkedHashSet<>();
        List<String> fields = operation == Operation.LIST_DEVICES ? DEVICE_NAME_FIELDS : OWNER_FIELDS;
        for (NormalizedRecord record : records) {
            for (String field : fields) {
                String value = record.text(field);
                if (value != null && !value.isBlank()) {
                    devices.add(value);
                    break;
                }
            }
        }
        Map<String, List<String>> entities = new LinkedHashMap<>();
        if (!devices.isEmpty()) entities.put(DEVICE, new ArrayList<>(devices));
        return entities;
    }
}
