package com.example.prr.model;

import java.util.List;

/**
 * Risk categorisation into known-knowns, known-unknowns and unknown-unknowns.
 * Known-knowns are always {@link Provenance#DERIVED} from the dependency risks;
 * the other two quadrants are speculative.
 */
public record RumsfeldMatrix(
        List<Finding> knownKnowns,
        List<Finding> knownUnknowns,
        List<Finding> unknownUnknowns,
        List<String> recommendations
) {
    public RumsfeldMatrix {
        knownKnowns = knownKnowns != null ? List.copyOf(knownKnowns) : List.of();
        knownUnknowns = knownUnknowns != null ? List.copyOf(knownUnknowns) : List.of();
        unknownUnknowns = unknownUnknowns != null ? List.copyOf(unknownUnknowns) : List.of();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }

    public static RumsfeldMatrix empty() {
        return new RumsfeldMatrix(List.of(), List.of(), List.of(), List.of());
    }
}
