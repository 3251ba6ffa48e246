package com.example.prr.model;

/**
 * One entry of the Rumsfeld matrix, tagged with where it came from.
 */
public record Finding(String text, Provenance provenance) {

    public static Finding derived(String text) {
        return new Finding(text, Provenance.DERIVED);
    }

    public static Finding inferred(String text) {
        return new Finding(text, Provenance.INFERRED);
    }

    public static Finding fallback(String text) {
        return new Finding(text, Provenance.FALLBACK);
    }
}
