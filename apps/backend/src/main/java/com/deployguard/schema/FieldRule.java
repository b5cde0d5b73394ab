package com.deployguard.schema;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;

/**
 * Per-field constraints. Every member is optional; {@code min}/{@code max} bound numeric values,
 * {@code minLength}/{@code maxLength} bound string length.
 */
@Builder(toBuilder = true)
public record FieldRule(
        String type,
        String pattern,
        BigDecimal min,
        BigDecimal max,
        Integer minLength,
        Integer maxLength,
        List<Object> enumValues
) {
    public static FieldRule ofType(String type) {
        return FieldRule.builder().type(type).build();
    }
}
