package com.example.prr.service;

import com.example.prr.model.ErrorCategory;

import java.util.List;

/**
 * Final result of a stage's model call after the retry policy has run:
 * a validated payload, or the category and errors of the last failed attempt.
 *
 * @param payload  validated payload ({@code null} on failure)
 * @param category failure category ({@code null} on success)
 * @param errors   errors of the last failed attempt
 * @param notes    coercions applied by the validator
 * @param attempts number of gateway calls issued
 */
public record InferenceOutcome<T>(
        T payload,
        ErrorCategory category,
        List<String> errors,
        List<String> notes,
        int attempts
) {
    public InferenceOutcome {
        errors = errors != null ? List.copyOf(errors) : List.of();
        notes = notes != null ? List.copyOf(notes) : List.of();
    }

    public static <T> InferenceOutcome<T> success(T payload, List<String> notes, int attempts) {
        return new InferenceOutcome<>(payload, null, List.of(), notes, attempts);
    }

    public static <T> InferenceOutcome<T> failure(ErrorCategory category, List<String> errors, int attempts) {
        return new InferenceOutcome<>(null, category, errors, List.of(), attempts);
    }

    public boolean isSuccess() {
        return category == null;
    }

    /** One-line summary of the failure, for issues and logs. */
    public String failureSummary() {
        return "%s after %d attempt(s): %s".formatted(category, attempts, String.join("; ", errors));
    }
}
