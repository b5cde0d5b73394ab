package com.deployguard.model;

import com.deployguard.util.JsonCanonicalizer;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One structured record of a {@link Dataset}. Field order is the natural key order; the
 * field map is read-only (nested values are taken as-is and must not be mutated by callers).
 */
public record DataRecord(Map<String, Object> fields) {

    public DataRecord {
        fields = Collections.unmodifiableMap(new TreeMap<>(fields == null ? Map.of() : fields));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static DataRecord of(Map<String, Object> fields) {
        return new DataRecord(fields);
    }

    @JsonValue
    @Override
    public Map<String, Object> fields() {
        return fields;
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    /** Present, non-null and not an empty string. */
    public boolean hasValue(String field) {
        Object v = fields.get(field);
        return v != null && !(v instanceof String s && s.isEmpty());
    }

    /** Normalized identity used to key records across comparisons; null when the field is absent. */
    public String identity(String identityField) {
        Object v = fields.get(identityField);
        return v == null ? null : JsonCanonicalizer.scalarText(v);
    }

    public DataRecord with(String field, Object value) {
        Map<String, Object> copy = new TreeMap<>(fields);
        copy.put(field, value);
        return new DataRecord(copy);
    }
}
