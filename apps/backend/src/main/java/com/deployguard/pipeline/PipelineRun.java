package com.deployguard.pipeline;

import com.deployguard.model.Dataset;

/**
 * Result of {@link ValidationPipeline#execute}. {@code post} and {@code output} are null when
 * the PRE phase did not reach READY.
 */
public record PipelineRun(PhaseReport pre, PhaseReport post, Dataset output, PipelineState state) {

    public boolean deployed() {
        return post != null && state == PipelineState.COMPLETED;
    }

    public boolean rollbackTriggered() {
        return post != null && post.rollbackTriggered();
    }
}
