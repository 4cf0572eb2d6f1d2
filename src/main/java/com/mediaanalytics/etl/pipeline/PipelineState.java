package com.mediaanalytics.etl.pipeline;

/**
 * Stages of one pipeline run.
 *
 * Runs move forward through {@code INIT -> SCHEMA_READY -> EXTRACTED -> TRANSFORMED -> LOADED}.
 * {@link #COMPLETED_EMPTY} ends a run with no input after {@link #SCHEMA_READY};
 * {@link #FAILED} is reachable from any non-terminal state.
 */
public enum PipelineState {
    INIT,
    SCHEMA_READY,
    EXTRACTED,
    TRANSFORMED,
    LOADED,
    COMPLETED_EMPTY,
    FAILED;

    public boolean isTerminal() {
        return this == LOADED || this == COMPLETED_EMPTY || this == FAILED;
    }

    public boolean isSuccessful() {
        return this == LOADED || this == COMPLETED_EMPTY;
    }
}
