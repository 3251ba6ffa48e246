package com.example.prr.model;

import com.example.prr.exception.InvalidInputException;

/**
 * Project metadata submitted alongside the architecture diagram.
 * Immutable once a pipeline run starts.
 *
 * @param name           Project name (non-blank)
 * @param description    Free-text description of the service (non-blank)
 * @param businessImpact Declared business impact
 */
public record ProjectMetadata(
        String name,
        String description,
        BusinessImpact businessImpact
) {

    /**
     * Checks the validity constraints every stage relies on.
     *
     * @throws InvalidInputException if a field is missing or blank
     */
    public ProjectMetadata validate() {
        if (name == null || name.isBlank()) {
            throw new InvalidInputException("Project name is required");
        }
        if (description == null || description.isBlank()) {
            throw new InvalidInputException("Project description is required");
        }
        if (businessImpact == null) {
            throw new InvalidInputException(
                    "Business impact is required (one of: critical, high, medium, low)");
        }
        return this;
    }
}
