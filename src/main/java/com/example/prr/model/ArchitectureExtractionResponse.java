package com.example.prr.model;

import java.util.List;

/**
 * Raw component/dependency listing returned by the model for a diagram.
 * SPOFs, critical paths and the tier are derived afterwards, never taken from the model.
 */
public record ArchitectureExtractionResponse(
        List<SystemComponent> components,
        List<Dependency> dependencies,
        List<String> recommendations
) {}
