package com.example.prr.service;

import com.example.prr.model.ArchitectureExtractionResponse;
import com.example.prr.model.ArchitectureGraph;
import com.example.prr.model.AvailabilityTier;
import com.example.prr.model.BlastRadius;
import com.example.prr.model.ChaosExperiment;
import com.example.prr.model.ChaosTestPlan;
import com.example.prr.model.ComponentKind;
import com.example.prr.model.Dependency;
import com.example.prr.model.Hypothesis;
import com.example.prr.model.PrrSection;
import com.example.prr.model.PrrSectionHeading;
import com.example.prr.model.ReportNarrativeResponse;
import com.example.prr.model.ResilienceNarrativeResponse;
import com.example.prr.model.RumsfeldMatrix;
import com.example.prr.model.SteadyState;
import com.example.prr.model.SystemComponent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.example.prr.support.TestFixtures.component;
import static com.example.prr.support.TestFixtures.ecommerceComponents;
import static com.example.prr.support.TestFixtures.ecommerceDependencies;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SchemaValidator}.
 */
class SchemaValidatorTest {

    private final SchemaValidator validator = new SchemaValidator();

    @Test
    void validateExtraction_safeDeviations_areCoercedWithNotes() {
        ArchitectureExtractionResponse candidate = new ArchitectureExtractionResponse(
                List.of(
                        new SystemComponent("  Web  ", ComponentKind.UI, "storefront", Arrays.asList("React", null, " ")),
                        new SystemComponent("Orders", null, null, null),
                        new SystemComponent("web", ComponentKind.UI, "duplicate", List.of())),
                List.of(
                        new Dependency("WEB", "orders", "REST"),
                        new Dependency("Web", "Orders", "REST"),
                        new Dependency("Orders", "Orders", "loop")),
                List.of(" Add caching ", ""));

        ValidationResult<ArchitectureExtractionResponse> result = validator.validateExtraction(candidate);

        assertThat(result.isValid()).isTrue();
        ArchitectureExtractionResponse listing = result.payload();
        assertThat(listing.components()).extracting(SystemComponent::name).containsExactly("Web", "Orders");
        assertThat(listing.components().get(0).technologies()).containsExactly("React");
        assertThat(listing.components().get(1).kind()).isEqualTo(ComponentKind.SERVICE);
        assertThat(listing.dependencies()).containsExactly(new Dependency("Web", "Orders", "REST"));
        assertThat(listing.recommendations()).containsExactly("Add caching");
        assertThat(result.notes()).hasSize(4);
    }

    @Test
    void validateExtraction_unknownEndpoint_isRejected() {
        ArchitectureExtractionResponse candidate = new ArchitectureExtractionResponse(
                List.of(component("Web", ComponentKind.UI)),
                List.of(new Dependency("Web", "Ghost", "REST")),
                List.of());

        ValidationResult<ArchitectureExtractionResponse> result = validator.validateExtraction(candidate);

        assertThat(result.isValid()).isFalse();
        assertThat(result.payload()).isNull();
        assertThat(result.errors()).containsExactly("dependencies[0]: target 'Ghost' is not a listed component");
    }

    @Test
    void validateExtraction_missingComponents_isRejected() {
        assertThat(validator.validateExtraction(new ArchitectureExtractionResponse(null, List.of(), List.of()))
                .errors()).containsExactly("Field 'components' is missing");
        assertThat(validator.validateExtraction(null).isValid()).isFalse();
    }

    @Test
    void validateGraph_pathThatSkipsAnEdge_isRejected() {
        ArchitectureGraph graph = new ArchitectureGraph(ecommerceComponents(), ecommerceDependencies(),
                List.of(List.of("Frontend Web App", "Authentication Service")), List.of(), List.of(),
                AvailabilityTier.TIER2, "", false);

        ValidationResult<ArchitectureGraph> result = validator.validateGraph(graph);

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).singleElement().asString().contains("is not a connected walk");
    }

    @Test
    void validateGraph_missingTier_isRejected() {
        ArchitectureGraph graph = new ArchitectureGraph(ecommerceComponents(), ecommerceDependencies(),
                List.of(), List.of(), List.of(), null, "", false);

        assertThat(validator.validateGraph(graph).errors()).containsExactly("Availability tier is missing");
    }

    @Test
    void validateResilienceNarrative_emptyQuadrant_isRejected() {
        ResilienceNarrativeResponse candidate = new ResilienceNarrativeResponse(
                List.of(new Hypothesis("Gateway degrades gracefully", "inject latency", null)),
                List.of(" "), List.of("Novel failure modes"), List.of(), List.of());

        ValidationResult<ResilienceNarrativeResponse> result = validator.validateResilienceNarrative(candidate);

        assertThat(result.errors()).containsExactly("Field 'knownUnknowns' must contain at least one entry");
    }

    @Test
    void validateResilienceNarrative_unnamedBlastRadius_isDroppedWithNote() {
        ResilienceNarrativeResponse candidate = new ResilienceNarrativeResponse(
                List.of(new Hypothesis("Gateway degrades gracefully", null, null)),
                List.of("Peak load"), List.of("Novel failure modes"),
                Arrays.asList(new BlastRadius(" ", List.of("x"), List.of(), "y"),
                        new BlastRadius(" Gateway Latency ", List.of("slow"), null, null)),
                null);

        ValidationResult<ResilienceNarrativeResponse> result = validator.validateResilienceNarrative(candidate);

        assertThat(result.isValid()).isTrue();
        assertThat(result.payload().blastRadius()).extracting(BlastRadius::experimentName)
                .containsExactly("Gateway Latency");
        assertThat(result.payload().hypotheses().get(0).testApproach()).isEmpty();
        assertThat(result.notes()).containsExactly("Dropped blast-radius entry without experiment name");
    }

    @Test
    void validatePlan_unmatchedBlastRadiusAndBadThreshold_areReported() {
        ArchitectureGraph graph = new ArchitectureGraph(ecommerceComponents(), ecommerceDependencies(),
                List.of(), List.of(), List.of(), AvailabilityTier.TIER2, "", false);
        ChaosTestPlan plan = new ChaosTestPlan(
                List.of(),
                List.of(new SteadyState("Gateway Response Time", "latency", "p95", "fast", "API Gateway")),
                List.of(),
                List.of(new ChaosExperiment("Gateway Latency", "inject", List.of("API Gateway"), "ok", null)),
                RumsfeldMatrix.empty(),
                List.of(new BlastRadius("Other", List.of(), List.of(), "")),
                false);

        ValidationResult<ChaosTestPlan> result = validator.validatePlan(plan, graph);

        assertThat(result.errors()).containsExactlyInAnyOrder(
                "Blast-radius entry 'Other' has no matching experiment",
                "Experiment 'Gateway Latency' has no blast-radius entry",
                "Steady state 'Gateway Response Time' has unparseable threshold 'fast'");
    }

    @Test
    void validateReportNarrative_reordersByHeadingAndDropsUnknown() {
        List<PrrSection> sections = new ArrayList<>();
        PrrSectionHeading[] headings = PrrSectionHeading.values();
        for (int i = headings.length - 1; i >= 0; i--) {
            sections.add(new PrrSection(headings[i].title(), "Prose for " + headings[i].name()));
        }
        sections.add(new PrrSection("Appendix", "extra"));

        ValidationResult<ReportNarrativeResponse> result =
                validator.validateReportNarrative(new ReportNarrativeResponse(sections));

        assertThat(result.isValid()).isTrue();
        assertThat(result.payload().sections()).extracting(PrrSection::heading)
                .containsExactly(Arrays.stream(headings).map(PrrSectionHeading::title).toArray(String[]::new));
        assertThat(result.notes()).containsExactly("Dropped section with unknown heading 'Appendix'");
    }

    @Test
    void validateReportNarrative_missingSection_isRejected() {
        ValidationResult<ReportNarrativeResponse> result = validator.validateReportNarrative(
                new ReportNarrativeResponse(List.of(new PrrSection("Service Overview", "text"))));

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).hasSize(PrrSectionHeading.values().length - 1);
    }
}
