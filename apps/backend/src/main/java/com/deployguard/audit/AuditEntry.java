package com.deployguard.audit;

import com.deployguard.model.Finding;

import java.time.Instant;
import java.util.List;

/**
 * One immutable link of an audit chain.
 * {@code selfHash = SHA256(prevHash + canonical(all other fields))}.
 */
public record AuditEntry(
        long sequence,
        Instant timestamp,
        String actor,
        String phase,
        String datasetRootChecksum,
        List<Finding> findings,
        double riskScore,
        String prevHash,
        String selfHash
) {
    public AuditEntry {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public boolean hasErrors() {
        return findings.stream().anyMatch(Finding::isError);
    }
}
