package com.example.prr.model;

import java.util.Arrays;
import java.util.List;

/**
 * The three analytical stages, in execution order.
 */
public enum PipelineStage {
    EXTRACTION,
    PLANNING,
    SYNTHESIS;

    /** Stages that consume this stage's output, directly or transitively. */
    public List<PipelineStage> downstream() {
        PipelineStage[] all = values();
        return Arrays.asList(all).subList(ordinal() + 1, all.length);
    }
}
