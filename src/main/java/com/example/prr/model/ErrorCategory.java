package com.example.prr.model;

/**
 * Error taxonomy shared by every pipeline stage.
 * Only {@link #INPUT} is ever thrown; the other categories are recorded on the stage outcome.
 */
public enum ErrorCategory {
    /** Malformed or missing upstream artifact. Not retried. */
    INPUT,
    /** Gateway timeout or unavailability. Retried once with backoff, then falls back. */
    INFERENCE_TRANSIENT,
    /** Model output failed schema validation. One corrective retry, then falls back. */
    VALIDATION,
    /** Cross-artifact invariant violated and repaired (or recorded). */
    CONSISTENCY
}
