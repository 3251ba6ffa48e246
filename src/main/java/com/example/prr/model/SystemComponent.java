package com.example.prr.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.List;
import java.util.Objects;

/**
 * A component identified in the architecture diagram.
 *
 * @param name         Unique name within the graph
 * @param kind         Component role (ui, api, service, database, external)
 * @param description  Short purpose of the component
 * @param technologies Technologies used, in the order they were listed
 */
public record SystemComponent(
        String name,
        @JsonAlias("type") ComponentKind kind,
        String description,
        List<String> technologies
) {
    public SystemComponent {
        technologies = technologies != null
                ? technologies.stream().filter(Objects::nonNull).toList()
                : List.of();
    }
}
