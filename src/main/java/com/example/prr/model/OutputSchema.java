package com.example.prr.model;

/**
 * Named schemas that model output is validated against.
 */
public enum OutputSchema {
    ARCHITECTURE_GRAPH,
    RESILIENCE_NARRATIVE,
    REPORT_NARRATIVE
}
