package com.example.prr.inference;

/**
 * Asks a model for structured output on behalf of a pipeline stage.
 * Implementations are stateless (no conversation memory across calls), enforce the
 * configured timeout and never throw for provider or parsing errors: those come back
 * as a typed {@link InferenceResult} failure.
 */
public interface InferenceGateway {

    <T> InferenceResult<T> infer(InferenceRequest request, Class<T> outputType);
}
