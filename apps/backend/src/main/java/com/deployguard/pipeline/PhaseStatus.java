package com.deployguard.pipeline;

/** INCONCLUSIVE means the phase timed out before integrity could be established. */
public enum PhaseStatus { PASSED, FAILED, INCONCLUSIVE }
