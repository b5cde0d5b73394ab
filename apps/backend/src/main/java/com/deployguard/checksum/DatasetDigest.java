package com.deployguard.checksum;

import java.util.List;
import java.util.Map;

/**
 * Root and per-record checksums of one dataset. {@code leaves} keeps the first occurrence of a
 * duplicated identity; the root covers every record, duplicates included.
 */
public record DatasetDigest(
        String root,
        Map<String, String> leaves,
        List<String> duplicates,
        int recordCount
) {
    public DatasetDigest {
        leaves = Map.copyOf(leaves);
        duplicates = List.copyOf(duplicates);
    }

    public boolean hasDuplicates() {
        return !duplicates.isEmpty();
    }
}
