package com.deployguard.checksum;

import java.util.Map;

/**
 * Summary statistics of a dataset used for drift detection.
 *
 * @param meanRecordSize mean size in bytes of the canonical record serialization
 * @param numericFields  mean and standard deviation of every top-level numeric field
 */
public record DatasetStats(
        int recordCount,
        double meanRecordSize,
        Map<String, FieldStats> numericFields
) {
    public DatasetStats {
        numericFields = numericFields == null ? Map.of() : Map.copyOf(numericFields);
    }

    public record FieldStats(int count, double mean, double stddev) {}
}
