package com.openforge.netagent.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One backend item expressed in standard field names.
 * Values may be null when a mapped path was absent in the source record.
 *
 * @param toolName tool the record came from
 * @param fields   standard field → value, in rule order
 */
public record NormalizedRecord(String toolName, Map<String, Object> fields) {

    public NormalizedRecord {
        // may hold nulls
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Object get(String field) {
        return fields.get(field);
    }

    /** String form of a field, or null. */
    public String text(String field) {
        Object value = fields.get(field);
        return value == null ? null : String.valueOf(value);
    }
}
