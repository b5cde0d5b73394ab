package com.deployguard.pipeline;

import com.deployguard.model.Dataset;

/**
 * The caller's mutating operation. Only its input, its output and whether it threw are observed.
 */
@FunctionalInterface
public interface DeploymentAction {
    Dataset apply(Dataset validated) throws Exception;
}
