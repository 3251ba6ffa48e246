package com.example.prr.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Output of the resilience planning stage.
 * Experiment names and blast-radius experiment names match one to one.
 */
public record ChaosTestPlan(
        List<DependencyRisk> dependencyRisks,
        List<SteadyState> steadyStates,
        List<Hypothesis> hypotheses,
        List<ChaosExperiment> experiments,
        RumsfeldMatrix rumsfeldMatrix,
        List<BlastRadius> blastRadius,
        boolean degraded
) {
    public ChaosTestPlan {
        dependencyRisks = dependencyRisks != null ? List.copyOf(dependencyRisks) : List.of();
        steadyStates = steadyStates != null ? List.copyOf(steadyStates) : List.of();
        hypotheses = hypotheses != null ? List.copyOf(hypotheses) : List.of();
        experiments = experiments != null ? List.copyOf(experiments) : List.of();
        rumsfeldMatrix = rumsfeldMatrix != null ? rumsfeldMatrix : RumsfeldMatrix.empty();
        blastRadius = blastRadius != null ? List.copyOf(blastRadius) : List.of();
    }

    /** Well-formed plan with no content, used when the graph has no components. */
    public static ChaosTestPlan empty() {
        return new ChaosTestPlan(List.of(), List.of(), List.of(), List.of(),
                RumsfeldMatrix.empty(), List.of(), true);
    }

    @JsonIgnore
    public List<String> experimentNames() {
        return experiments.stream().map(ChaosExperiment::name).toList();
    }
}
