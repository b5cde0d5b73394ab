package com.deployguard.model;

import java.util.List;

/**
 * Reduces a set of findings to a risk score in [0, 1].
 */
public final class RiskScorer {
    private RiskScorer() {}

    static final double ERROR_WEIGHT = 0.4;
    static final double WARNING_WEIGHT = 0.1;

    public static double score(List<Finding> errors, List<Finding> warnings) {
        for (Finding f : errors) {
            if (f.category() == FindingCategory.AUDIT_TAMPER_DETECTED
                    || f.category() == FindingCategory.STORAGE_FAILURE) {
                return 1.0;
            }
        }
        double raw = ERROR_WEIGHT * errors.size() + WARNING_WEIGHT * warnings.size();
        return Math.min(1.0, round(raw));
    }

    private static double round(double v) {
        return Math.round(v * 1000d) / 1000d;
    }
}
