package com.example.prr.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.List;
import java.util.Objects;

/**
 * Impact scope attributed to one experiment.
 *
 * @param experimentName Name of the experiment this entry describes
 * @param directImpact   Immediate effects of the fault
 * @param indirectImpact Cascading effects
 * @param containment    How the impact is bounded
 */
public record BlastRadius(
        @JsonAlias("test") String experimentName,
        List<String> directImpact,
        List<String> indirectImpact,
        String containment
) {
    public BlastRadius {
        directImpact = directImpact != null ? directImpact.stream().filter(Objects::nonNull).toList() : List.of();
        indirectImpact = indirectImpact != null ? indirectImpact.stream().filter(Objects::nonNull).toList() : List.of();
    }
}
