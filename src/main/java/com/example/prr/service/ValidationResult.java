package com.example.prr.service;

import java.util.List;

/**
 * Result of validating a candidate payload: either {@code Valid(payload)} or {@code Invalid(errors)}.
 * A valid result may still carry notes about coercions that were applied.
 *
 * @param payload the (possibly coerced) payload, {@code null} when invalid
 * @param errors  validation errors, empty when valid
 * @param notes   coercions applied to make the payload valid
 */
public record ValidationResult<T>(T payload, List<String> errors, List<String> notes) {

    public ValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        notes = notes != null ? List.copyOf(notes) : List.of();
    }

    public static <T> ValidationResult<T> valid(T payload) {
        return new ValidationResult<>(payload, List.of(), List.of());
    }

    public static <T> ValidationResult<T> valid(T payload, List<String> notes) {
        return new ValidationResult<>(payload, List.of(), notes);
    }

    public static <T> ValidationResult<T> invalid(List<String> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("An invalid result needs at least one error");
        }
        return new ValidationResult<>(null, errors, List.of());
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
