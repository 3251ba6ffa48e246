package com.example.prr.service;

import com.example.prr.inference.InferenceFailure;
import com.example.prr.inference.InferenceRequest;
import com.example.prr.model.ArchitectureExtractionResponse;
import com.example.prr.model.ComponentKind;
import com.example.prr.model.Dependency;
import com.example.prr.model.ErrorCategory;
import com.example.prr.model.OutputSchema;
import com.example.prr.model.PipelineStage;
import com.example.prr.support.ScriptedInferenceGateway;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.prr.support.TestFixtures.component;
import static com.example.prr.support.TestFixtures.ecommerceListing;
import static com.example.prr.support.TestFixtures.properties;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ResilientInferenceCaller}.
 */
class ResilientInferenceCallerTest {

    private static final InferenceRequest REQUEST = new InferenceRequest(PipelineStage.EXTRACTION,
            OutputSchema.ARCHITECTURE_GRAPH, "system", "Describe the diagram", null);

    private final SchemaValidator validator = new SchemaValidator();
    private final ScriptedInferenceGateway gateway = new ScriptedInferenceGateway();
    private final ResilientInferenceCaller caller = new ResilientInferenceCaller(gateway, properties());

    @Test
    void call_validFirstAnswer_succeedsInOneAttempt() {
        gateway.respond(OutputSchema.ARCHITECTURE_GRAPH, ecommerceListing());

        InferenceOutcome<ArchitectureExtractionResponse> outcome = call();

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(outcome.payload().components()).hasSize(8);
    }

    @Test
    void call_timeoutThenValid_retriesSameRequest() {
        gateway.fail(OutputSchema.ARCHITECTURE_GRAPH, InferenceFailure.TIMED_OUT)
                .respond(OutputSchema.ARCHITECTURE_GRAPH, ecommerceListing());

        InferenceOutcome<ArchitectureExtractionResponse> outcome = call();

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(2);
        assertThat(gateway.requests()).containsExactly(REQUEST, REQUEST);
    }

    @Test
    void call_schemaViolation_rePromptsWithErrors() {
        ArchitectureExtractionResponse broken = new ArchitectureExtractionResponse(
                List.of(component("Web", ComponentKind.UI)),
                List.of(new Dependency("Web", "Ghost", "REST")),
                List.of());
        gateway.respond(OutputSchema.ARCHITECTURE_GRAPH, broken)
                .respond(OutputSchema.ARCHITECTURE_GRAPH, ecommerceListing());

        InferenceOutcome<ArchitectureExtractionResponse> outcome = call();

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(gateway.requests()).hasSize(2);
        assertThat(gateway.requests().get(1).userPrompt())
                .startsWith("Describe the diagram")
                .contains("CORRECTION REQUIRED")
                .contains("target 'Ghost' is not a listed component");
    }

    @Test
    void call_unavailableTwice_returnsTransientFailure() {
        gateway.fail(OutputSchema.ARCHITECTURE_GRAPH, InferenceFailure.UNAVAILABLE);

        InferenceOutcome<ArchitectureExtractionResponse> outcome = call();

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.category()).isEqualTo(ErrorCategory.INFERENCE_TRANSIENT);
        assertThat(outcome.attempts()).isEqualTo(ResilientInferenceCaller.MAX_ATTEMPTS);
        assertThat(gateway.callsFor(OutputSchema.ARCHITECTURE_GRAPH)).isEqualTo(2);
    }

    @Test
    void call_malformedTwice_returnsValidationFailure() {
        gateway.fail(OutputSchema.ARCHITECTURE_GRAPH, InferenceFailure.MALFORMED);

        InferenceOutcome<ArchitectureExtractionResponse> outcome = call();

        assertThat(outcome.category()).isEqualTo(ErrorCategory.VALIDATION);
        assertThat(outcome.failureSummary()).startsWith("VALIDATION after 2 attempt(s): MALFORMED");
    }

    private InferenceOutcome<ArchitectureExtractionResponse> call() {
        return caller.call(REQUEST, ArchitectureExtractionResponse.class, validator::validateExtraction);
    }
}
