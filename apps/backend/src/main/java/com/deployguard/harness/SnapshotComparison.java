package com.deployguard.harness;

import java.time.Instant;

/**
 * @param found false when no snapshot exists under the name; {@code matches} is then false too
 */
public record SnapshotComparison(
        String name,
        boolean found,
        boolean matches,
        Integer snapshotVersion,
        String expectedHash,
        String actualHash,
        Instant snapshotCreatedAt
) {}
