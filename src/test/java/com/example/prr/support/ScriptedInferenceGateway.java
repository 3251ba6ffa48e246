package com.example.prr.support;

import com.example.prr.inference.InferenceFailure;
import com.example.prr.inference.InferenceGateway;
import com.example.prr.inference.InferenceRequest;
import com.example.prr.inference.InferenceResult;
import com.example.prr.model.OutputSchema;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway that replays scripted answers per output schema, in order. The last answer of
 * a schema repeats; a schema with no script answers {@link InferenceFailure#UNAVAILABLE}.
 */
public class ScriptedInferenceGateway implements InferenceGateway {

    private final Map<OutputSchema, Deque<InferenceResult<?>>> script = new EnumMap<>(OutputSchema.class);
    private final List<InferenceRequest> requests = new ArrayList<>();

    public ScriptedInferenceGateway respond(OutputSchema schema, Object payload) {
        script.computeIfAbsent(schema, s -> new ArrayDeque<>()).add(InferenceResult.success(payload));
        return this;
    }

    public ScriptedInferenceGateway fail(OutputSchema schema, InferenceFailure failure) {
        script.computeIfAbsent(schema, s -> new ArrayDeque<>())
                .add(InferenceResult.failure(failure, "scripted " + failure));
        return this;
    }

    @Override
    public synchronized <T> InferenceResult<T> infer(InferenceRequest request, Class<T> outputType) {
        requests.add(request);
        Deque<InferenceResult<?>> answers = script.get(request.schema());
        if (answers == null || answers.isEmpty()) {
            return InferenceResult.failure(InferenceFailure.UNAVAILABLE, "no scripted answer");
        }
        InferenceResult<?> next = answers.size() > 1 ? answers.poll() : answers.peek();
        if (!next.isSuccess()) {
            return InferenceResult.failure(next.failure(), next.detail());
        }
        return InferenceResult.success(outputType.cast(next.payload()));
    }

    public synchronized List<InferenceRequest> requests() {
        return List.copyOf(requests);
    }

    public synchronized long callsFor(OutputSchema schema) {
        return requests.stream().filter(r -> r.schema() == schema).count();
    }
}
