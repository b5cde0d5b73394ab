package com.deployguard.audit.dto;

import java.util.List;

/**
 * Result of re-deriving every hash of a chain.
 *
 * @param brokenAtIndex index of the first entry that failed verification, null when ok
 * @param tailHash      stored selfHash of the last entry, null for an empty chain
 */
public record AuditVerifyReport(
        String chainId,
        int entriesVerified,
        boolean ok,
        Integer brokenAtIndex,
        List<AuditIssue> breaks,
        String tailHash
) {
    public AuditVerifyReport {
        breaks = List.copyOf(breaks);
    }
}
