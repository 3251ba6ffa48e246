package com.example.prr.model;

import java.util.List;

/**
 * Speculative plan content returned by the model for a given set of experiments.
 */
public record ResilienceNarrativeResponse(
        List<Hypothesis> hypotheses,
        List<String> knownUnknowns,
        List<String> unknownUnknowns,
        List<BlastRadius> blastRadius,
        List<String> recommendations
) {}
