package com.example.prr.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Optional;

/**
 * Quantified normal-operation invariant used as the pass/fail baseline of an experiment.
 *
 * @param name        Steady-state name
 * @param description What is being observed
 * @param metric      Metric expression, e.g. "p95 latency &lt; 300ms"
 * @param threshold   Parseable quantity, see {@link Threshold}
 * @param component   Component the steady state monitors
 */
public record SteadyState(
        String name,
        String description,
        String metric,
        String threshold,
        String component
) {
    @JsonIgnore
    public Optional<Threshold> parsedThreshold() {
        return Threshold.parse(threshold);
    }
}
