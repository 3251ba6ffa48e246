package com.example.prr.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Business impact declared by the project owner when submitting a diagram.
 */
public enum BusinessImpact {
    CRITICAL("Direct revenue impact"),
    HIGH("Indirect revenue impact"),
    MEDIUM("Operational impact"),
    LOW("Minimal business impact");

    private final String label;

    BusinessImpact(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Case-insensitive parsing; returns {@code null} for blank or unknown values. */
    @JsonCreator
    public static BusinessImpact fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
