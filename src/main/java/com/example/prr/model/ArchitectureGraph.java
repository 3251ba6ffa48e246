package com.example.prr.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Output of the architecture extraction stage.
 * Every name referenced by {@code dependencies}, {@code criticalPaths} and
 * {@code singlePointsOfFailure} exists in {@code components}.
 *
 * @param components            Components of the system, in diagram order
 * @param dependencies          Directed dependencies between components
 * @param criticalPaths         Directed paths from user-facing components to data stores
 * @param singlePointsOfFailure Articulation points of the dependency graph
 * @param recommendations       Architecture recommendations
 * @param availabilityTier      Tier assigned by the rule table
 * @param tierJustification     Deterministic explanation of the tier
 * @param degraded              True if the graph is fallback content
 */
public record ArchitectureGraph(
        List<SystemComponent> components,
        List<Dependency> dependencies,
        List<List<String>> criticalPaths,
        List<SinglePointOfFailure> singlePointsOfFailure,
        List<String> recommendations,
        AvailabilityTier availabilityTier,
        String tierJustification,
        boolean degraded
) {
    public ArchitectureGraph {
        components = components != null ? List.copyOf(components) : List.of();
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        criticalPaths = criticalPaths != null
                ? criticalPaths.stream().map(List::copyOf).toList()
                : List.of();
        singlePointsOfFailure = singlePointsOfFailure != null ? List.copyOf(singlePointsOfFailure) : List.of();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }

    @JsonIgnore
    public Set<String> componentNames() {
        return components.stream()
                .map(SystemComponent::name)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Optional<SystemComponent> component(String name) {
        return components.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return components.isEmpty();
    }

    public boolean isSinglePointOfFailure(String name) {
        return singlePointsOfFailure.stream().anyMatch(s -> s.name().equals(name));
    }

    public boolean isOnCriticalPath(String name) {
        return criticalPaths.stream().anyMatch(path -> path.contains(name));
    }
}
