package com.deployguard.pipeline;

import com.deployguard.anomaly.AnomalyFinding;
import com.deployguard.checksum.ChecksumDiff;
import com.deployguard.checksum.DatasetDigest;
import com.deployguard.checksum.DatasetStats;
import com.deployguard.harness.TestRunReport;
import com.deployguard.model.Finding;
import com.deployguard.model.FindingCategory;
import com.deployguard.model.ValidationResult;
import com.deployguard.reconcile.ReconciliationReport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything one phase's checks gathered. Built off the pipeline's state so that a timed-out
 * run can simply be discarded.
 */
final class PhaseWork {

    final List<Finding> errors = new ArrayList<>();
    final List<Finding> warnings = new ArrayList<>();
    final List<AnomalyFinding> anomalies = new ArrayList<>();
    DatasetDigest digest;
    DatasetStats stats;
    ChecksumDiff diff;
    ReconciliationReport reconciliation;
    ReconciliationReport baselineComparison;
    TestRunReport testReport;
    boolean timedOut;

    static PhaseWork timedOut(Phase phase, Duration timeout) {
        PhaseWork w = new PhaseWork();
        w.timedOut = true;
        w.error(Finding.error(FindingCategory.PHASE_TIMEOUT, phase.auditName(),
                phase + " phase did not finish within " + timeout));
        return w;
    }

    void add(ValidationResult r) {
        errors.addAll(r.errors());
        warnings.addAll(r.warnings());
    }

    void error(Finding f) {
        errors.add(f);
    }

    void warning(Finding f) {
        warnings.add(f);
    }

    /** A hard error stops the remaining checks of the phase. */
    boolean hardStop() {
        return errors.stream().anyMatch(f -> f.category().isHard());
    }

    PhaseStatus status() {
        if (timedOut) return PhaseStatus.INCONCLUSIVE;
        return errors.isEmpty() ? PhaseStatus.PASSED : PhaseStatus.FAILED;
    }

    String root() {
        return digest == null ? null : digest.root();
    }

    List<Finding> findings() {
        List<Finding> all = new ArrayList<>(errors);
        all.addAll(warnings);
        return all;
    }
}
