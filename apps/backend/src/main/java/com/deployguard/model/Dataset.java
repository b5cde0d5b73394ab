package com.deployguard.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Ordered, immutable record sequence plus its capture metadata. A changed dataset is always a
 * new value.
 */
public record Dataset(
        List<DataRecord> records,
        String identityField,
        String source,
        Instant capturedAt
) {
    public Dataset {
        Objects.requireNonNull(identityField, "identityField");
        records = List.copyOf(records == null ? List.of() : records);
        capturedAt = capturedAt == null ? Instant.now() : capturedAt;
    }

    public static Dataset of(String identityField, List<Map<String, Object>> rows) {
        return of(identityField, "unspecified", rows);
    }

    public static Dataset of(String identityField, String source, List<Map<String, Object>> rows) {
        List<DataRecord> list = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) list.add(new DataRecord(row));
        return new Dataset(list, identityField, source, Instant.now());
    }

    public int size() {
        return records.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return records.isEmpty();
    }

    /** Records keyed by identity; on duplicate identities the first occurrence wins. */
    public Map<String, DataRecord> byIdentity() {
        Map<String, DataRecord> m = new LinkedHashMap<>();
        for (DataRecord r : records) {
            String id = r.identity(identityField);
            if (id != null) m.putIfAbsent(id, r);
        }
        return m;
    }

    public List<String> identities() {
        List<String> ids = new ArrayList<>(records.size());
        for (DataRecord r : records) ids.add(r.identity(identityField));
        return ids;
    }

    public Dataset withRecords(List<DataRecord> newRecords, String newSource) {
        return new Dataset(newRecords, identityField, newSource, Instant.now());
    }

    /** New dataset with {@code fn} applied to the record whose identity is {@code identity}. */
    public Dataset mapRecord(String identity, UnaryOperator<DataRecord> fn) {
        List<DataRecord> out = new ArrayList<>(records.size());
        for (DataRecord r : records) {
            out.add(identity.equals(r.identity(identityField)) ? fn.apply(r) : r);
        }
        return withRecords(out, source);
    }
}
