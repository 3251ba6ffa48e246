package com.example.prr.model;

import java.util.List;

/**
 * Artifact produced by a stage together with its status and any recorded issues.
 *
 * @param artifact Stage output
 * @param status   {@link StageStatus#SUCCEEDED} or {@link StageStatus#DEGRADED}
 * @param issues   Fallbacks, validation failures and repairs recorded while producing the artifact
 */
public record StageOutcome<T>(T artifact, StageStatus status, List<PipelineIssue> issues) {

    public StageOutcome {
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public static <T> StageOutcome<T> of(T artifact, boolean degraded, List<PipelineIssue> issues) {
        return new StageOutcome<>(artifact, degraded ? StageStatus.DEGRADED : StageStatus.SUCCEEDED, issues);
    }

    public boolean degraded() {
        return status == StageStatus.DEGRADED;
    }
}
