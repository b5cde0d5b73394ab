package com.deployguard.audit;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Per-actor summary of an audit chain over a time window.
 */
public record ComplianceReport(
        String chainId,
        Instant from,
        Instant to,
        int totalEntries,
        Map<String, ActorSummary> byActor,
        List<AuditAlert> alerts,
        boolean chainIntact
) {
    public record ActorSummary(
            String actor,
            int entries,
            int preValidations,
            int postValidations,
            int rollbacks,
            double averageRiskScore,
            int highRiskEntries
    ) {}
}
