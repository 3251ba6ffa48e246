package com.example.prr.model;

/**
 * Main states of a {@link PipelineRun}. Degradation is tracked separately per stage.
 */
public enum RunState {
    CREATED,
    EXTRACTING,
    EXTRACTED,
    PLANNING,
    PLANNED,
    SYNTHESIZING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
