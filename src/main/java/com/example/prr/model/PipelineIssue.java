package com.example.prr.model;

/**
 * A recorded problem that did not stop the stage: a fallback, a validation failure or a repair.
 *
 * @param category Error category
 * @param stage    Stage that recorded the issue
 * @param message  Human-readable detail
 */
public record PipelineIssue(ErrorCategory category, PipelineStage stage, String message) {}
