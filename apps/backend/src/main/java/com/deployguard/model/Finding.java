package com.deployguard.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One problem found by a check. Errors carry {@link Severity#CRITICAL}, warnings
 * {@link Severity#WARNING}. {@code subject} names what the finding is about (an identity, a
 * field, a metric, a test) and is null for dataset-wide findings.
 */
public record Finding(
        FindingCategory category,
        Severity severity,
        String subject,
        String message
) {
    public static Finding error(FindingCategory category, String message) {
        return new Finding(category, Severity.CRITICAL, null, message);
    }

    public static Finding error(FindingCategory category, String subject, String message) {
        return new Finding(category, Severity.CRITICAL, subject, message);
    }

    public static Finding warning(FindingCategory category, String message) {
        return new Finding(category, Severity.WARNING, null, message);
    }

    public static Finding warning(FindingCategory category, String subject, String message) {
        return new Finding(category, Severity.WARNING, subject, message);
    }

    @JsonIgnore
    public boolean isError() {
        return severity == Severity.CRITICAL;
    }

    @Override
    public String toString() {
        return subject == null
                ? category + ": " + message
                : category + "[" + subject + "]: " + message;
    }
}
