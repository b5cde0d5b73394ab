package com.deployguard.reconcile;

/**
 * One differing leaf between two versions of a record.
 *
 * @param path dotted path with bracketed list indexes, e.g. {@code address.city} or {@code items[2].qty}
 */
public record FieldDiff(String path, Kind kind, Object before, Object after) {

    public enum Kind { ADDED, REMOVED, MODIFIED }
}
