package com.example.prr.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Availability tier with its target and yearly downtime budget.
 */
public enum AvailabilityTier {
    TIER1(1, "99.99%", "52.6 minutes"),
    TIER2(2, "99.9%", "8.76 hours"),
    TIER3(3, "99.5%", "1.83 days"),
    TIER4(4, "99.0%", "3.65 days");

    private final int level;
    private final String target;
    private final String yearlyDowntime;

    AvailabilityTier(int level, String target, String yearlyDowntime) {
        this.level = level;
        this.target = target;
        this.yearlyDowntime = yearlyDowntime;
    }

    public int level() {
        return level;
    }

    public String target() {
        return target;
    }

    public String yearlyDowntime() {
        return yearlyDowntime;
    }

    /** Human-readable label, e.g. "Tier 2". */
    public String label() {
        return "Tier " + level;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AvailabilityTier fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String compact = raw.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s_-]", "");
        try {
            return valueOf(compact);
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    public static AvailabilityTier ofLevel(int level) {
        for (AvailabilityTier tier : values()) {
            if (tier.level == level) {
                return tier;
            }
        }
        throw new IllegalArgumentException("No availability tier with level " + level);
    }
}
