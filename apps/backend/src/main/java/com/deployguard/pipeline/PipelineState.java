package com.deployguard.pipeline;

/**
 * {@code IDLE -> READY | ABORTED}, {@code READY -> COMPLETED | ROLLED_BACK}. A storage failure
 * in either phase leaves the pipeline {@code ABORTED}.
 */
public enum PipelineState {
    IDLE, READY, ABORTED, COMPLETED, ROLLED_BACK;

    public boolean isTerminal() {
        return this == ABORTED || this == COMPLETED || this == ROLLED_BACK;
    }
}
