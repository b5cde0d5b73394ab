package com.deployguard.anomaly;

import com.deployguard.model.Severity;
import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Drift of one metric between baseline and candidate statistics.
 *
 * @param deltaPercent     {@code |candidate - baseline| / baseline * 100}; infinite when the baseline is zero
 * @param magnitudePercent drift the severity was judged on, a decrease counted as the equivalent
 *                         growth; infinite across zero
 * @param threshold        the threshold that was crossed, null for INFO findings
 */
public record AnomalyFinding(
        String metric,
        double baselineValue,
        double candidateValue,
        double deltaPercent,
        double magnitudePercent,
        Double threshold,
        Severity severity
) {
    @JsonIgnore
    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }
}
