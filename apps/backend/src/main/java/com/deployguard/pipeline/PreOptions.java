package com.deployguard.pipeline;

import com.deployguard.harness.TestHarness;
import com.deployguard.schema.DatasetSchema;
import lombok.Builder;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * @param scope          identities the deployment action may modify; empty means nothing may change
 * @param requiredFields checked on every record in addition to the schema's own required list
 * @param createBaseline store the validated dataset as a new version of {@code baselineName}
 * @param timeout        overrides {@code integrity.pipeline.pre-timeout}
 */
@Builder(toBuilder = true)
public record PreOptions(
        DatasetSchema schema,
        List<String> requiredFields,
        Set<String> scope,
        TestHarness harness,
        String baselineName,
        boolean createBaseline,
        String baselineDescription,
        String snapshotName,
        String actor,
        Duration timeout
) {
    public PreOptions {
        requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
        scope = scope == null ? Set.of() : Set.copyOf(scope);
    }

    public static PreOptions defaults() {
        return PreOptions.builder().build();
    }
}
