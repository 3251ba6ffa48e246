package com.example.prr.model;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Directed dependency between two components: {@code source} calls or reads from {@code target}.
 *
 * @param source Name of the depending component
 * @param target Name of the component depended upon
 * @param kind   Nature of the dependency (REST, Database, Queue, ...)
 */
public record Dependency(
        String source,
        String target,
        @JsonAlias("type") String kind
) {}
