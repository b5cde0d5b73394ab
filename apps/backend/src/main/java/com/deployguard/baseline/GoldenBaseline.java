package com.deployguard.baseline;

import com.deployguard.checksum.DatasetStats;
import com.deployguard.model.DataRecord;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable known-good reference for a named dataset. A new version is a new object.
 *
 * @param records full record snapshots keyed by identity, null when only checksums were kept
 */
public record GoldenBaseline(
        String name,
        int version,
        Instant createdAt,
        String description,
        String identityField,
        String rootChecksum,
        Map<String, String> leafChecksums,
        DatasetStats stats,
        Map<String, DataRecord> records
) {
    public GoldenBaseline {
        leafChecksums = Map.copyOf(leafChecksums);
        records = records == null ? null : Map.copyOf(records);
    }

    public boolean hasRecords() {
        return records != null;
    }

    public String key() {
        return name + "@" + version;
    }
}
