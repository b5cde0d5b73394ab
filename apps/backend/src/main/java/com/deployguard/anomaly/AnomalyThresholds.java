package com.deployguard.anomaly;

import com.deployguard.config.IntegrityProperties;
import lombok.Builder;

/**
 * Warning/critical thresholds in percent per metric family. A null threshold disables that level.
 */
@Builder(toBuilder = true)
public record AnomalyThresholds(
        Double recordCountWarning,
        Double recordCountCritical,
        Double meanSizeWarning,
        Double meanSizeCritical,
        Double fieldMeanWarning,
        Double fieldMeanCritical,
        Double fieldStddevWarning,
        Double fieldStddevCritical
) {
    public static AnomalyThresholds defaults() {
        return from(new IntegrityProperties.Anomaly());
    }

    public static AnomalyThresholds from(IntegrityProperties.Anomaly p) {
        return new AnomalyThresholds(
                p.getRecordCountWarning(), p.getRecordCountCritical(),
                p.getMeanSizeWarning(), p.getMeanSizeCritical(),
                p.getFieldMeanWarning(), p.getFieldMeanCritical(),
                p.getFieldStddevWarning(), p.getFieldStddevCritical());
    }
}
