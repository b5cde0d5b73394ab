package com.deployguard.schema;

import lombok.Builder;
import lombok.Singular;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Declared shape of a dataset. {@code type} is one of {@code array} (rules apply to every
 * record), {@code object} (the dataset holds exactly one record) or {@code scalar}.
 */
@Builder(toBuilder = true)
public record DatasetSchema(
        String type,
        @Singular("requiredField") List<String> required,
        @Singular Map<String, FieldRule> properties
) {
    public static final Set<String> DATASET_TYPES = Set.of("object", "array", "scalar");
    public static final Set<String> FIELD_TYPES =
            Set.of("string", "number", "integer", "boolean", "object", "array", "null");

    public DatasetSchema {
        // null entries are kept so that problem() can report them
        required = required == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(required));
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    /**
     * First structural problem of this schema, or null when it is usable.
     */
    public String problem() {
        if (type == null) return "schema has no type";
        if (!DATASET_TYPES.contains(type)) return "unknown schema type '" + type + "'";
        for (String r : required) {
            if (r == null || r.isBlank()) return "blank entry in required list";
        }
        for (Map.Entry<String, FieldRule> e : properties.entrySet()) {
            String field = e.getKey();
            FieldRule rule = e.getValue();
            if (field == null || field.isBlank()) return "property with a blank name";
            if (rule == null) return "field '" + field + "' has no rule";
            if (rule.type() != null && !FIELD_TYPES.contains(rule.type())) {
                return "field '" + field + "' has unknown type '" + rule.type() + "'";
            }
            if (rule.pattern() != null) {
                try {
                    Pattern.compile(rule.pattern());
                } catch (PatternSyntaxException ex) {
                    return "field '" + field + "' has invalid pattern: " + ex.getDescription();
                }
            }
            if (rule.min() != null && rule.max() != null && rule.min().compareTo(rule.max()) > 0) {
                return "field '" + field + "' has min greater than max";
            }
            if (rule.minLength() != null && rule.maxLength() != null && rule.minLength() > rule.maxLength()) {
                return "field '" + field + "' has minLength greater than maxLength";
            }
        }
        return null;
    }

    /**
     * Reads a JSON-Schema-like map: {@code type}, {@code required}, {@code properties} with
     * {@code type}, {@code pattern}, {@code min}/{@code minimum}, {@code max}/{@code maximum},
     * {@code minLength}, {@code maxLength}, {@code enum}.
     *
     * @throws IllegalArgumentException when the map cannot be read as a schema
     */
    @SuppressWarnings("unchecked")
    public static DatasetSchema fromMap(Map<String, Object> raw) {
        if (raw == null) throw new IllegalArgumentException("schema is null");
        Object type = raw.get("type");
        if (type != null && !(type instanceof String)) {
            throw new IllegalArgumentException("'type' must be a string");
        }

        List<String> required = new ArrayList<>();
        Object req = raw.get("required");
        if (req != null) {
            if (!(req instanceof Collection<?> c)) throw new IllegalArgumentException("'required' must be a list");
            for (Object o : c) required.add(String.valueOf(o));
        }

        Map<String, FieldRule> props = new LinkedHashMap<>();
        Object p = raw.get("properties");
        if (p != null) {
            if (!(p instanceof Map<?, ?> pm)) throw new IllegalArgumentException("'properties' must be an object");
            for (Map.Entry<?, ?> e : pm.entrySet()) {
                if (!(e.getValue() instanceof Map<?, ?> fm)) {
                    throw new IllegalArgumentException("rule for '" + e.getKey() + "' must be an object");
                }
                props.put(String.valueOf(e.getKey()), readRule((Map<String, Object>) fm));
            }
        }
        return new DatasetSchema((String) type, required, props);
    }

    private static FieldRule readRule(Map<String, Object> m) {
        Object enumValues = m.get("enum");
        if (enumValues != null && !(enumValues instanceof Collection<?>)) {
            throw new IllegalArgumentException("'enum' must be a list");
        }
        return FieldRule.builder()
                .type(m.get("type") == null ? null : String.valueOf(m.get("type")))
                .pattern(m.get("pattern") == null ? null : String.valueOf(m.get("pattern")))
                .min(decimal(m.getOrDefault("min", m.get("minimum"))))
                .max(decimal(m.getOrDefault("max", m.get("maximum"))))
                .minLength(integer(m.get("minLength")))
                .maxLength(integer(m.get("maxLength")))
                .enumValues(enumValues == null ? null : List.copyOf((Collection<?>) enumValues))
                .build();
    }

    private static BigDecimal decimal(Object v) {
        if (v == null) return null;
        try {
            return new BigDecimal(String.valueOf(v));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a number: " + v, e);
        }
    }

    private static Integer integer(Object v) {
        BigDecimal d = decimal(v);
        return d == null ? null : d.intValueExact();
    }
}
