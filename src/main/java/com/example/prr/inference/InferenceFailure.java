package com.example.prr.inference;

/**
 * Typed failure of a single gateway call.
 */
public enum InferenceFailure {
    /** The call did not complete within the configured timeout. */
    TIMED_OUT,
    /** The provider could not be reached or returned an error. */
    UNAVAILABLE,
    /** The provider answered, but the answer could not be parsed into the requested type. */
    MALFORMED;

    public boolean isTransient() {
        return this != MALFORMED;
    }
}
