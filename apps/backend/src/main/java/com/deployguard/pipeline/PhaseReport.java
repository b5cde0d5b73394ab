package com.deployguard.pipeline;

import com.deployguard.anomaly.AnomalyFinding;
import com.deployguard.checksum.ChecksumDiff;
import com.deployguard.harness.TestRunReport;
import com.deployguard.model.Finding;
import com.deployguard.reconcile.ReconciliationReport;

import java.time.Instant;
import java.util.List;

/**
 * Structured outcome of one phase. {@code rollbackReasons} lists every contributing finding
 * whenever {@code rollbackTriggered} is set. In POST, {@code reconciliation} diffs the result
 * against the PRE input and {@code baselineComparison} against the golden baseline, if one was
 * named.
 */
public record PhaseReport(
        String sessionId,
        String chainId,
        Phase phase,
        PhaseStatus status,
        boolean passed,
        List<Finding> errors,
        List<Finding> warnings,
        List<AnomalyFinding> anomalies,
        String datasetRootChecksum,
        ChecksumDiff checksumDiff,
        ReconciliationReport reconciliation,
        ReconciliationReport baselineComparison,
        TestRunReport testReport,
        String auditEntryId,
        String auditEntryHash,
        boolean rollbackTriggered,
        List<String> rollbackReasons,
        double riskScore,
        PipelineState state,
        Instant startedAt,
        long durationMillis
) {
    public PhaseReport {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
        rollbackReasons = rollbackReasons == null ? List.of() : List.copyOf(rollbackReasons);
    }
}
