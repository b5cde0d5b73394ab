package com.deployguard.checksum;

import java.util.List;
import java.util.Set;

/**
 * Per-identity classification of the change between two digests, sorted by identity.
 */
public record ChecksumDiff(List<Entry> entries, Set<String> scope) {

    public ChecksumDiff {
        entries = List.copyOf(entries);
        scope = Set.copyOf(scope);
    }

    public record Entry(String identity, ChangeStatus status, boolean inScope) {}

    /** Changes that break the scope declaration: unexpected changes and out-of-scope removals. */
    public List<Entry> violations() {
        return entries.stream()
                .filter(e -> e.status() == ChangeStatus.UNEXPECTED_CHANGED
                        || (e.status() == ChangeStatus.REMOVED && !e.inScope()))
                .toList();
    }

    public List<Entry> unscopedAdditions() {
        return entries.stream()
                .filter(e -> e.status() == ChangeStatus.ADDED && !e.inScope())
                .toList();
    }

    public List<Entry> withStatus(ChangeStatus status) {
        return entries.stream().filter(e -> e.status() == status).toList();
    }

    public ChangeStatus statusOf(String identity) {
        return entries.stream()
                .filter(e -> e.identity().equals(identity))
                .map(Entry::status)
                .findFirst()
                .orElse(null);
    }
}
