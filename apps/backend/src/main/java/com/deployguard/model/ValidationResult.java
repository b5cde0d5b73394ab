package com.deployguard.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one or more checks: passed iff there are no errors. Warnings never fail a result.
 */
public record ValidationResult(
        boolean passed,
        List<Finding> errors,
        List<Finding> warnings,
        double riskScore
) {
    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ValidationResult of(List<Finding> errors, List<Finding> warnings) {
        return new ValidationResult(errors.isEmpty(), errors, warnings, RiskScorer.score(errors, warnings));
    }

    public static ValidationResult ok() {
        return of(List.of(), List.of());
    }

    public static ValidationResult error(Finding error) {
        return of(List.of(error), List.of());
    }

    public ValidationResult merge(ValidationResult other) {
        List<Finding> e = new ArrayList<>(errors);
        e.addAll(other.errors);
        List<Finding> w = new ArrayList<>(warnings);
        w.addAll(other.warnings);
        return of(e, w);
    }
}
