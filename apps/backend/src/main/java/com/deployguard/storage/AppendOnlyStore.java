package com.deployguard.storage;

import java.util.List;

/**
 * Durable, append-only streams of serialized entries. Entries are never rewritten or removed
 * through this interface; implementations throw {@link StorageFailureException} on any I/O
 * problem instead of returning partial results.
 */
public interface AppendOnlyStore {

    /**
     * Appends one entry and returns its 0-based position in the stream. The entry is durable
     * when this method returns.
     */
    long append(String streamId, String payload);

    /** Every entry of the stream in append order; empty for an unknown stream. */
    List<String> readAll(String streamId);

    /** Number of entries in the stream. */
    default long size(String streamId) {
        return readAll(streamId).size();
    }

    /** Ids of the streams whose id starts with {@code prefix}, sorted. */
    List<String> streams(String prefix);
}
