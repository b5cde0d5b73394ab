package com.deployguard.model;

/**
 * Classification of every problem the pipeline can report.
 * <p>
 * {@code hard} categories stop the remaining checks of the phase they occur in.
 */
public enum FindingCategory {
    SCHEMA_VIOLATION(true),
    INCOMPLETE_RECORD(true),
    DUPLICATE_IDENTITY(true),
    CHECKSUM_SCOPE_VIOLATION(false),
    UNSCOPED_ADDITION(false),
    ANOMALY_CRITICAL(false),
    ANOMALY_WARNING(false),
    BASELINE_DRIFT(false),
    SNAPSHOT_MISMATCH(false),
    AUDIT_TAMPER_DETECTED(true),
    TEST_FAILURE(false),
    PHASE_TIMEOUT(true),
    DEPLOYMENT_FAILURE(true),
    STORAGE_FAILURE(true);

    private final boolean hard;

    FindingCategory(boolean hard) {
        this.hard = hard;
    }

    public boolean isHard() {
        return hard;
    }
}
