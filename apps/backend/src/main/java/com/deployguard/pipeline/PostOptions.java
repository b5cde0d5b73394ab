package com.deployguard.pipeline;

import com.deployguard.anomaly.AnomalyThresholds;
import com.deployguard.harness.TestHarness;
import com.deployguard.schema.DatasetSchema;
import lombok.Builder;

import java.time.Duration;

/**
 * Null members fall back to what the PRE phase was given: its schema, harness, baseline name,
 * snapshot name and actor.
 */
@Builder(toBuilder = true)
public record PostOptions(
        DatasetSchema schema,
        TestHarness harness,
        String compareBaseline,
        Integer baselineVersion,
        AnomalyThresholds thresholds,
        String snapshotName,
        String actor,
        Duration timeout
) {
    public static PostOptions defaults() {
        return PostOptions.builder().build();
    }
}
