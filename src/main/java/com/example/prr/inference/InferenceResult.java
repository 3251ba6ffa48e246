package com.example.prr.inference;

/**
 * Outcome of a single gateway call: a candidate payload, or a typed failure with detail.
 *
 * @param payload candidate payload ({@code null} on failure)
 * @param failure failure kind ({@code null} on success)
 * @param detail  failure detail for logs and corrective prompts
 */
public record InferenceResult<T>(T payload, InferenceFailure failure, String detail) {

    public static <T> InferenceResult<T> success(T payload) {
        return new InferenceResult<>(payload, null, null);
    }

    public static <T> InferenceResult<T> failure(InferenceFailure failure, String detail) {
        return new InferenceResult<>(null, failure, detail);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
