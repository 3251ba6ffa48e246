package com.example.prr.model;

/**
 * Per-stage status inside a {@link PipelineRun}.
 * {@link #DEGRADED} means the stage produced fallback content and must never be reported as succeeded.
 */
public enum StageStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    DEGRADED,
    FAILED
}
