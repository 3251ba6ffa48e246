package com.example.prr.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * Aggregate root of one pipeline execution: one metadata + artifact pair and
 * at most one artifact per stage. Immutable; every transition returns a new run.
 *
 * @param id            Run identifier
 * @param metadata      Project metadata (fixed for the lifetime of the run)
 * @param artifactId    Identifier of the uploaded diagram
 * @param state         Main state-machine position
 * @param stageStatuses Status of each stage
 * @param graph         Extraction outcome, or {@code null}
 * @param plan          Planning outcome, or {@code null}
 * @param document      Synthesis outcome, or {@code null}
 * @param failureReason Why the run failed or was cancelled, or {@code null}
 * @param createdAt     Creation time
 * @param updatedAt     Time of the last transition
 */
public record PipelineRun(
        String id,
        ProjectMetadata metadata,
        String artifactId,
        RunState state,
        Map<PipelineStage, StageStatus> stageStatuses,
        StageOutcome<ArchitectureGraph> graph,
        StageOutcome<ChaosTestPlan> plan,
        StageOutcome<PrrDocument> document,
        String failureReason,
        Instant createdAt,
        Instant updatedAt
) {
    public PipelineRun {
        EnumMap<PipelineStage, StageStatus> statuses = new EnumMap<>(PipelineStage.class);
        for (PipelineStage stage : PipelineStage.values()) {
            statuses.put(stage, StageStatus.PENDING);
        }
        if (stageStatuses != null) {
            statuses.putAll(stageStatuses);
        }
        stageStatuses = Collections.unmodifiableMap(statuses);
    }

    public static PipelineRun create(ProjectMetadata metadata, String artifactId, Instant now) {
        return new PipelineRun(UUID.randomUUID().toString(), metadata, artifactId, RunState.CREATED,
                null, null, null, null, null, now, now);
    }

    public StageStatus statusOf(PipelineStage stage) {
        return stageStatuses.get(stage);
    }

    /** True if any completed stage used fallback content. */
    public boolean degraded() {
        return stageStatuses.containsValue(StageStatus.DEGRADED);
    }

    /** Marks a stage as running and moves to the matching in-progress state. */
    public PipelineRun begin(PipelineStage stage, Instant now) {
        RunState inProgress = switch (stage) {
            case EXTRACTION -> RunState.EXTRACTING;
            case PLANNING -> RunState.PLANNING;
            case SYNTHESIS -> RunState.SYNTHESIZING;
        };
        return new PipelineRun(id, metadata, artifactId, inProgress,
                withStatus(stage, StageStatus.RUNNING), graph, plan, document, null, createdAt, now);
    }

    /** Stores a fresh graph and invalidates the plan and document derived from the previous one. */
    public PipelineRun withGraph(StageOutcome<ArchitectureGraph> outcome, Instant now) {
        return new PipelineRun(id, metadata, artifactId, RunState.EXTRACTED,
                resetDownstream(PipelineStage.EXTRACTION, outcome.status()),
                outcome, null, null, null, createdAt, now);
    }

    /** Stores a fresh plan and invalidates the document derived from the previous one. */
    public PipelineRun withPlan(StageOutcome<ChaosTestPlan> outcome, Instant now) {
        return new PipelineRun(id, metadata, artifactId, RunState.PLANNED,
                resetDownstream(PipelineStage.PLANNING, outcome.status()),
                graph, outcome, null, null, createdAt, now);
    }

    public PipelineRun withDocument(StageOutcome<PrrDocument> outcome, Instant now) {
        return new PipelineRun(id, metadata, artifactId, RunState.COMPLETED,
                resetDownstream(PipelineStage.SYNTHESIS, outcome.status()),
                graph, plan, outcome, null, createdAt, now);
    }

    public PipelineRun fail(PipelineStage stage, String reason, Instant now) {
        return new PipelineRun(id, metadata, artifactId, RunState.FAILED,
                withStatus(stage, StageStatus.FAILED), graph, plan, document, reason, createdAt, now);
    }

    public PipelineRun cancel(String reason, Instant now) {
        return new PipelineRun(id, metadata, artifactId, RunState.CANCELLED,
                stageStatuses, graph, plan, document, reason, createdAt, now);
    }

    private Map<PipelineStage, StageStatus> withStatus(PipelineStage stage, StageStatus status) {
        EnumMap<PipelineStage, StageStatus> copy = new EnumMap<>(stageStatuses);
        copy.put(stage, status);
        return copy;
    }

    private Map<PipelineStage, StageStatus> resetDownstream(PipelineStage stage, StageStatus status) {
        EnumMap<PipelineStage, StageStatus> copy = new EnumMap<>(stageStatuses);
        copy.put(stage, status);
        stage.downstream().forEach(s -> copy.put(s, StageStatus.PENDING));
        return copy;
    }
}
