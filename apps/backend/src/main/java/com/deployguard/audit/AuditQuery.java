package com.deployguard.audit;

import lombok.Builder;

import java.time.Instant;

/**
 * Read-only filter over persisted entries; null members do not filter. {@code from} and
 * {@code to} are inclusive.
 */
@Builder
public record AuditQuery(
        String actor,
        String phase,
        Instant from,
        Instant to,
        Double minRiskScore,
        Integer limit
) {
    public static AuditQuery all() {
        return AuditQuery.builder().build();
    }

    public boolean matches(AuditEntry e) {
        if (actor != null && !actor.equals(e.actor())) return false;
        if (phase != null && !phase.equals(e.phase())) return false;
        if (from != null && e.timestamp().isBefore(from)) return false;
        if (to != null && e.timestamp().isAfter(to)) return false;
        return minRiskScore == null || e.riskScore() >= minRiskScore;
    }
}
