package com.deployguard.reconcile;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Identity-keyed difference between two datasets. Lists are sorted by identity.
 */
public record ReconciliationReport(
        List<String> added,
        List<String> removed,
        List<RecordChange> changed
) {
    public ReconciliationReport {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
        changed = List.copyOf(changed);
    }

    public static ReconciliationReport empty() {
        return new ReconciliationReport(List.of(), List.of(), List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && changed.isEmpty();
    }

    public int differenceCount() {
        return added.size() + removed.size() + changed.size();
    }
}
