package com.example.prr.model;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Resilience hypothesis to be confirmed by an experiment.
 *
 * @param statement    Expected system behaviour under the fault
 * @param testApproach How the hypothesis is exercised
 * @param provenance   Whether the hypothesis was inferred or is a fallback
 */
public record Hypothesis(
        @JsonAlias("description") String statement,
        String testApproach,
        Provenance provenance
) {
    public Hypothesis withProvenance(Provenance newProvenance) {
        return new Hypothesis(statement, testApproach, newProvenance);
    }
}
