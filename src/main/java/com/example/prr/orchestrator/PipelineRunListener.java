package com.example.prr.orchestrator;

import com.example.prr.model.PipelineRun;

/**
 * Receives every intermediate state of a run as the orchestrator drives it.
 */
@FunctionalInterface
public interface PipelineRunListener {

    PipelineRunListener NONE = run -> { };

    void onUpdate(PipelineRun run);
}
