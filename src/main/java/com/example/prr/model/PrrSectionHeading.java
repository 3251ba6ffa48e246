package com.example.prr.model;

/**
 * Fixed, ordered section list of a PRR document.
 * Export and UI tabs index sections by position, so the order is part of the contract.
 */
public enum PrrSectionHeading {
    SERVICE_OVERVIEW("Service Overview"),
    ARCHITECTURE_ANALYSIS("Architecture Analysis"),
    RESILIENCE_TESTING_STRATEGY("Resilience Testing Strategy"),
    AVAILABILITY_DESIGN("Availability Design"),
    OBSERVABILITY_STRATEGY("Observability Strategy"),
    RISKS_AND_MITIGATIONS("Identified Risks & Mitigations"),
    RECOMMENDATIONS("Recommendations & Next Steps");

    private final String title;

    PrrSectionHeading(String title) {
        this.title = title;
    }

    public String title() {
        return title;
    }

    /** Matches a heading by enum name or title, ignoring case. */
    public static PrrSectionHeading fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim();
        for (PrrSectionHeading heading : values()) {
            if (heading.title.equalsIgnoreCase(value) || heading.name().equalsIgnoreCase(value)) {
                return heading;
            }
        }
        return null;
    }
}
