package com.deployguard.anomaly;

import com.deployguard.checksum.DatasetStats;
import com.deployguard.config.IntegrityProperties;
import com.deployguard.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Threshold-based drift detection between two statistics snapshots. Pure arithmetic: the same
 * inputs always produce the same findings.
 * <p>
 * Severity is decided on the drift magnitude, where a decrease is measured as the equivalent
 * growth ({@code baseline / candidate - 1}) so that halving weighs the same as doubling. A drop
 * to zero or a rise from zero is unbounded.
 */
@Slf4j
@Component
public class AnomalyDetector {

    public static final String RECORD_COUNT = "record_count";
    public static final String MEAN_RECORD_SIZE = "mean_record_size";

    private final AnomalyThresholds defaults;

    @Autowired
    public AnomalyDetector(IntegrityProperties props) {
        this(AnomalyThresholds.from(props.getAnomaly()));
    }

    public AnomalyDetector(AnomalyThresholds defaults) {
        this.defaults = defaults;
    }

    public AnomalyThresholds defaults() {
        return defaults;
    }

    public List<AnomalyFinding> detect(DatasetStats baseline, DatasetStats candidate) {
        return detect(baseline, candidate, defaults);
    }

    public List<AnomalyFinding> detect(DatasetStats baseline, DatasetStats candidate, AnomalyThresholds t) {
        List<AnomalyFinding> out = new ArrayList<>();
        check(RECORD_COUNT, baseline.recordCount(), candidate.recordCount(),
                t.recordCountWarning(), t.recordCountCritical(), out);
        check(MEAN_RECORD_SIZE, baseline.meanRecordSize(), candidate.meanRecordSize(),
                t.meanSizeWarning(), t.meanSizeCritical(), out);

        for (Map.Entry<String, DatasetStats.FieldStats> e : baseline.numericFields().entrySet()) {
            DatasetStats.FieldStats c = candidate.numericFields().get(e.getKey());
            if (c == null) continue;
            String prefix = "field." + e.getKey();
            check(prefix + ".mean", e.getValue().mean(), c.mean(),
                    t.fieldMeanWarning(), t.fieldMeanCritical(), out);
            check(prefix + ".stddev", e.getValue().stddev(), c.stddev(),
                    t.fieldStddevWarning(), t.fieldStddevCritical(), out);
        }
        if (!out.isEmpty()) {
            log.debug("Anomaly detection: {} finding(s), {} critical", out.size(),
                    out.stream().filter(AnomalyFinding::isCritical).count());
        }
        return out;
    }

    /** {@code |c - b| / |b| * 100}, infinite when only the baseline is zero. */
    public static double deltaPercent(double b, double c) {
        if (b == c) return 0d;
        if (b == 0d) return Double.POSITIVE_INFINITY;
        return Math.abs(c - b) / Math.abs(b) * 100d;
    }

    /** Growth-equivalent drift in percent used to rank severity. */
    static double magnitudePercent(double b, double c) {
        if (b == c) return 0d;
        double lo = Math.min(Math.abs(b), Math.abs(c));
        double hi = Math.max(Math.abs(b), Math.abs(c));
        if (lo == 0d || Math.signum(b) != Math.signum(c)) return Double.POSITIVE_INFINITY;
        return (hi / lo - 1d) * 100d;
    }

    private void check(String metric, double b, double c, Double warning, Double critical,
                       List<AnomalyFinding> out) {
        double magnitude = magnitudePercent(b, c);
        if (magnitude == 0d) return;
        double delta = round(deltaPercent(b, c));
        double drift = round(magnitude);
        if (critical != null && magnitude > critical) {
            out.add(new AnomalyFinding(metric, b, c, delta, drift, critical, Severity.CRITICAL));
        } else if (warning != null && magnitude > warning) {
            out.add(new AnomalyFinding(metric, b, c, delta, drift, warning, Severity.WARNING));
        } else {
            out.add(new AnomalyFinding(metric, b, c, delta, drift, null, Severity.INFO));
        }
    }

    private static double round(double v) {
        return Double.isInfinite(v) ? v : Math.round(v * 100d) / 100d;
    }
}
