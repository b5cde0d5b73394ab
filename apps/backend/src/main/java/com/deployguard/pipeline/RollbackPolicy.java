package com.deployguard.pipeline;

import com.deployguard.model.Finding;

import java.util.ArrayList;
import java.util.List;

/**
 * POST rollback rule: every error recorded by the phase is a rollback trigger, and an
 * inconclusive phase always rolls back. Warnings never trigger on their own.
 */
final class RollbackPolicy {
    private RollbackPolicy() {}

    static boolean shouldRollBack(PhaseStatus status, List<Finding> errors) {
        return status == PhaseStatus.INCONCLUSIVE || !errors.isEmpty();
    }

    static List<String> reasons(PhaseStatus status, List<Finding> errors) {
        List<String> out = new ArrayList<>();
        if (status == PhaseStatus.INCONCLUSIVE) out.add("phase inconclusive: integrity could not be established");
        for (Finding f : errors) out.add(f.toString());
        return out;
    }
}
