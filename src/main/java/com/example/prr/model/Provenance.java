package com.example.prr.model;

/**
 * Where a piece of plan content came from.
 */
public enum Provenance {
    /** Computed from the architecture graph. */
    DERIVED,
    /** Produced by model inference and therefore speculative. */
    INFERRED,
    /** Deterministic default used because inference failed. */
    FALLBACK
}
