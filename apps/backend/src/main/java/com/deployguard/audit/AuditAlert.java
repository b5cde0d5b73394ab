package com.deployguard.audit;

import java.time.Instant;

/**
 * Raised when an appended entry carries a risk score above the configured alert threshold.
 */
public record AuditAlert(
        String id,
        String chainId,
        long sequence,
        Instant timestamp,
        Level level,
        String actor,
        String phase,
        double riskScore,
        String message
) {
    public enum Level { HIGH, CRITICAL }
}
