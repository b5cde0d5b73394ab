package com.deployguard.reconcile;

import java.util.List;

/** Field diffs of a record present on both sides; empty diffs mean only the checksum is known to differ. */
public record RecordChange(String identity, List<FieldDiff> fieldDiffs) {
    public RecordChange {
        fieldDiffs = List.copyOf(fieldDiffs);
    }
}
