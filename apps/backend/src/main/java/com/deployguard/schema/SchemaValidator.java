package com.deployguard.schema;

import com.deployguard.model.DataRecord;
import com.deployguard.model.Dataset;
import com.deployguard.model.Finding;
import com.deployguard.model.FindingCategory;
import com.deployguard.model.ValidationResult;
import com.deployguard.util.JsonCanonicalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Structural validation of a dataset against a {@link DatasetSchema}. Each field reports at
 * most its first violated rule; violations of all fields of all records are accumulated.
 */
@Component
@Slf4j
public class SchemaValidator {

    public ValidationResult validate(Dataset dataset, Map<String, Object> rawSchema) {
        try {
            return validate(dataset, DatasetSchema.fromMap(rawSchema));
        } catch (IllegalArgumentException | ArithmeticException e) {
            return ValidationResult.error(Finding.error(FindingCategory.SCHEMA_VIOLATION, "schema",
                    "Invalid schema: " + e.getMessage()));
        }
    }

    public ValidationResult validate(Dataset dataset, DatasetSchema schema) {
        if (schema == null) {
            return ValidationResult.error(Finding.error(FindingCategory.SCHEMA_VIOLATION, "schema",
                    "No schema supplied"));
        }
        String problem = schema.problem();
        if (problem != null) {
            return ValidationResult.error(Finding.error(FindingCategory.SCHEMA_VIOLATION, "schema",
                    "Invalid schema: " + problem));
        }

        List<Finding> errors = new ArrayList<>();
        switch (schema.type()) {
            case "scalar" -> errors.add(Finding.error(FindingCategory.SCHEMA_VIOLATION, null,
                    "Scalar schema cannot describe a record dataset"));
            case "object" -> {
                if (dataset.size() != 1) {
                    errors.add(Finding.error(FindingCategory.SCHEMA_VIOLATION, null,
                            "Object schema expects exactly one record, got " + dataset.size()));
                } else {
                    validateRecord(dataset, 0, schema, compile(schema), errors);
                }
            }
            default -> {
                Map<String, Pattern> patterns = compile(schema);
                for (int i = 0; i < dataset.size(); i++) {
                    validateRecord(dataset, i, schema, patterns, errors);
                }
            }
        }
        log.debug("Schema validation of {} record(s) from '{}': {} error(s)",
                dataset.size(), dataset.source(), errors.size());
        return ValidationResult.of(errors, List.of());
    }

    private void validateRecord(Dataset dataset, int index, DatasetSchema schema,
                                Map<String, Pattern> patterns, List<Finding> errors) {
        DataRecord record = dataset.records().get(index);
        String label = label(record, dataset.identityField(), index);

        for (String field : schema.required()) {
            if (!record.has(field)) {
                errors.add(Finding.error(FindingCategory.SCHEMA_VIOLATION, label + "." + field,
                        "Missing required field: " + field));
            }
        }
        for (Map.Entry<String, FieldRule> e : schema.properties().entrySet()) {
            String field = e.getKey();
            if (!record.has(field)) continue;
            String err = checkField(record.get(field), e.getValue(), patterns.get(field));
            if (err != null) {
                errors.add(Finding.error(FindingCategory.SCHEMA_VIOLATION, label + "." + field, err));
            }
        }
    }

    private String checkField(Object value, FieldRule rule, Pattern pattern) {
        if (rule.type() != null && !matchesType(value, rule.type())) {
            return "Type mismatch: expected " + rule.type() + ", got " + typeName(value);
        }
        if (rule.enumValues() != null && !rule.enumValues().isEmpty()) {
            boolean found = false;
            for (Object allowed : rule.enumValues()) {
                if (Objects.equals(JsonCanonicalizer.scalarText(allowed), JsonCanonicalizer.scalarText(value))) {
                    found = true;
                    break;
                }
            }
            if (!found) return "Value not in allowed set " + rule.enumValues();
        }
        if (value instanceof CharSequence s) {
            if (pattern != null && !pattern.matcher(s).find()) {
                return "Value does not match pattern: " + rule.pattern();
            }
            if (rule.minLength() != null && s.length() < rule.minLength()) {
                return "Value too short: minimum " + rule.minLength() + " characters";
            }
            if (rule.maxLength() != null && s.length() > rule.maxLength()) {
                return "Value too long: maximum " + rule.maxLength() + " characters";
            }
        }
        if (value instanceof Number n && (rule.min() != null || rule.max() != null)) {
            BigDecimal d = toDecimal(n);
            if (d == null) return "Value is not a finite number";
            if (rule.min() != null && d.compareTo(rule.min()) < 0) {
                return "Value below minimum: " + rule.min().toPlainString();
            }
            if (rule.max() != null && d.compareTo(rule.max()) > 0) {
                return "Value above maximum: " + rule.max().toPlainString();
            }
        }
        return null;
    }

    static boolean matchesType(Object value, String type) {
        return switch (type) {
            case "string" -> value instanceof CharSequence;
            case "number" -> value instanceof Number;
            case "integer" -> value instanceof Number n && isIntegral(n);
            case "boolean" -> value instanceof Boolean;
            case "object" -> value instanceof Map<?, ?>;
            case "array" -> value instanceof Collection<?> || (value != null && value.getClass().isArray());
            case "null" -> value == null;
            default -> false;
        };
    }

    private static boolean isIntegral(Number n) {
        BigDecimal d = toDecimal(n);
        return d != null && d.stripTrailingZeros().scale() <= 0;
    }

    private static BigDecimal toDecimal(Number n) {
        String text = JsonCanonicalizer.scalarText(n);
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String typeName(Object value) {
        if (value == null) return "null";
        if (value instanceof CharSequence) return "string";
        if (value instanceof Number) return "number";
        if (value instanceof Boolean) return "boolean";
        if (value instanceof Map<?, ?>) return "object";
        if (value instanceof Collection<?>) return "array";
        return value.getClass().getSimpleName();
    }

    private static String label(DataRecord record, String identityField, int index) {
        String id = record.identity(identityField);
        return id != null ? id : "#" + index;
    }

    private static Map<String, Pattern> compile(DatasetSchema schema) {
        Map<String, Pattern> out = new HashMap<>();
        schema.properties().forEach((field, rule) -> {
            if (rule.pattern() != null) out.put(field, Pattern.compile(rule.pattern()));
        });
        return out;
    }
}
