package com.example.prr.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Role of a component in an architecture diagram.
 */
public enum ComponentKind {
    UI,
    API,
    SERVICE,
    DATABASE,
    EXTERNAL;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parsing for model output: accepts common synonyms
     * ("frontend", "gateway", "db", "third-party") and returns {@code null}
     * for anything unrecognised so the validator can coerce it.
     */
    @JsonCreator
    public static ComponentKind fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "ui", "frontend", "web", "client", "mobile" -> UI;
            case "api", "gateway", "api gateway", "load balancer" -> API;
            case "service", "microservice", "backend", "worker" -> SERVICE;
            case "database", "db", "datastore", "storage", "cache" -> DATABASE;
            case "external", "third-party", "thirdparty", "saas", "cdn" -> EXTERNAL;
            default -> null;
        };
    }
}
