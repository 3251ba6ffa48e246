package com.example.prr.inference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Deterministic gateway that answers every call with a classpath fixture, one per output schema
 * ({@code fixtures/architecture-graph.json}, {@code fixtures/resilience-narrative.json},
 * {@code fixtures/report-narrative.json}). Selected with {@code prr.inference.mode=fixture}
 * for demos and tests; prompts and attachments are ignored.
 */
@Service
@ConditionalOnProperty(prefix = "prr.inference", name = "mode", havingValue = "fixture")
public class FixtureInferenceGateway implements InferenceGateway {

    private static final Logger log = LoggerFactory.getLogger(FixtureInferenceGateway.class);
    private static final String FIXTURE_DIR = "fixtures/";

    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public FixtureInferenceGateway() {
        log.warn("Fixture inference gateway active: model output is served from classpath fixtures");
    }

    @Override
    public <T> InferenceResult<T> infer(InferenceRequest request, Class<T> outputType) {
        String path = FIXTURE_DIR + request.schema().name().toLowerCase(Locale.ROOT).replace('_', '-') + ".json";
        String content;
        try {
            content = cache.computeIfAbsent(path, FixtureInferenceGateway::load);
        } catch (IllegalStateException e) {
            return InferenceResult.failure(InferenceFailure.UNAVAILABLE, e.getMessage());
        }
        try {
            T payload = SpringAiInferenceGateway.LENIENT_MAPPER.readValue(content, outputType);
            log.debug("{}: served fixture {}", request.stage(), path);
            return InferenceResult.success(payload);
        } catch (IOException e) {
            return InferenceResult.failure(InferenceFailure.MALFORMED,
                    "Fixture %s does not match %s: %s".formatted(path, outputType.getSimpleName(),
                            SpringAiInferenceGateway.rootCauseMessage(e)));
        }
    }

    private static String load(String path) {
        ClassPathResource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            throw new IllegalStateException("Fixture not found on classpath: " + path);
        }
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read fixture " + path + ": " + e.getMessage(), e);
        }
    }
}
