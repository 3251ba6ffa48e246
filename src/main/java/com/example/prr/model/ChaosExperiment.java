package com.example.prr.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A prioritised chaos experiment. Designed only, never executed by this system.
 *
 * @param name             Unique experiment name
 * @param description      Fault being injected
 * @param targetComponents Components the fault is injected into
 * @param expectedResult   Behaviour expected if the system is resilient
 * @param executionSpec    Chaos-injection configuration (a LitmusChaos ChaosEngine manifest)
 */
public record ChaosExperiment(
        String name,
        String description,
        List<String> targetComponents,
        String expectedResult,
        Map<String, Object> executionSpec
) {
    public ChaosExperiment {
        targetComponents = targetComponents != null
                ? targetComponents.stream().distinct().toList()
                : List.of();
        executionSpec = executionSpec != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(executionSpec))
                : Map.of();
    }
}
