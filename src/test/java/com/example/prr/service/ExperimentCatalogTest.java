package com.example.prr.service;

import com.example.prr.model.AvailabilityTier;
import com.example.prr.model.BlastRadius;
import com.example.prr.model.ChaosExperiment;
import com.example.prr.model.ComponentKind;
import com.example.prr.model.Finding;
import com.example.prr.model.Hypothesis;
import com.example.prr.model.Provenance;
import com.example.prr.model.SteadyState;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.example.prr.support.TestFixtures.component;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ExperimentCatalog}.
 */
class ExperimentCatalogTest {

    private final ExperimentCatalog catalog = new ExperimentCatalog();

    @Test
    void experimentFor_database_buildsPodDeleteEngineOnStatefulSet() {
        ChaosExperiment experiment = catalog.experimentFor(component("Product Database", ComponentKind.DATABASE));

        assertThat(experiment.name()).isEqualTo("Product Database Termination");
        assertThat(experiment.targetComponents()).containsExactly("Product Database");
        assertThat(experiment.description()).isEqualTo("Terminate the Product Database pod for 30 seconds");

        Map<String, Object> engine = experiment.executionSpec();
        assertThat(engine).containsEntry("apiVersion", "litmuschaos.io/v1alpha1")
                .containsEntry("kind", "ChaosEngine")
                .containsEntry("metadata", Map.of("name", "product-database-pod-delete"));
        @SuppressWarnings("unchecked")
        Map<String, Object> spec = (Map<String, Object>) engine.get("spec");
        assertThat(spec).containsEntry("chaosServiceAccount", "litmus-admin");
        assertThat(spec.get("appinfo")).isEqualTo(Map.of(
                "appns", "default", "applabel", "app=product-database", "appkind", "statefulset"));
    }

    @Test
    void experimentFor_service_formatsPercentInDescription() {
        ChaosExperiment experiment = catalog.experimentFor(component("Product Service", ComponentKind.SERVICE));

        assertThat(experiment.name()).isEqualTo("Product Service CPU Stress");
        assertThat(experiment.description()).isEqualTo("Stress CPU on Product Service to 80% for 2 minutes");
    }

    @Test
    void experimentFor_external_targetsOwnHostname() {
        ChaosExperiment experiment = catalog.experimentFor(component("Stripe Payments", ComponentKind.EXTERNAL));

        assertThat(experiment.name()).isEqualTo("Stripe Payments Outage Simulation");
        assertThat(experiment.executionSpec().toString())
                .contains("pod-dns-error")
                .contains("{name=TARGET_HOSTNAMES, value=stripe-payments}");
    }

    @Test
    void steadyStateFor_everyKind_hasParseableThreshold() {
        for (ComponentKind kind : ComponentKind.values()) {
            SteadyState state = catalog.steadyStateFor(component("Comp", kind), AvailabilityTier.TIER1);

            assertThat(state.parsedThreshold()).as(kind.name()).isPresent();
            assertThat(state.component()).isEqualTo("Comp");
        }
    }

    @Test
    void steadyStateFor_ui_usesTierTarget() {
        SteadyState state = catalog.steadyStateFor(component("Web", ComponentKind.UI), AvailabilityTier.TIER2);

        assertThat(state.name()).isEqualTo("Web Success Rate");
        assertThat(state.threshold()).isEqualTo("99.9%");
    }

    @Test
    void fallbacks_areTaggedAsFallback() {
        ChaosExperiment experiment = catalog.experimentFor(component("API Gateway", ComponentKind.API));

        List<Hypothesis> hypotheses = catalog.fallbackHypotheses(List.of(experiment));

        assertThat(hypotheses).singleElement()
                .satisfies(h -> assertThat(h.provenance()).isEqualTo(Provenance.FALLBACK))
                .satisfies(h -> assertThat(h.statement()).contains("API Gateway Latency Injection"));
        assertThat(catalog.fallbackKnownUnknowns()).hasSize(3).extracting(Finding::provenance)
                .containsOnly(Provenance.FALLBACK);
        assertThat(catalog.fallbackUnknownUnknowns()).isNotEmpty();
        assertThat(catalog.fallbackRecommendations()).isNotEmpty();
    }

    @Test
    void derivedBlastRadius_listsDirectAndTransitiveDependents() {
        ChaosExperiment experiment = catalog.experimentFor(component("Product Database", ComponentKind.DATABASE));

        BlastRadius radius = catalog.derivedBlastRadius(experiment,
                List.of("Product Service", "Inventory Service"), List.of("API Gateway"));

        assertThat(radius.experimentName()).isEqualTo("Product Database Termination");
        assertThat(radius.directImpact()).containsExactly(
                "Product Service loses reliable access to Product Database",
                "Inventory Service loses reliable access to Product Database");
        assertThat(radius.indirectImpact()).containsExactly("API Gateway is degraded through its dependency chain");
        assertThat(radius.containment()).isEqualTo("Impact limited to Product Database and 3 dependent component(s)");
    }

    @Test
    void derivedBlastRadius_noDependents_reportsTargetOnly() {
        ChaosExperiment experiment = catalog.experimentFor(component("Web", ComponentKind.UI));

        BlastRadius radius = catalog.derivedBlastRadius(experiment, List.of(), List.of());

        assertThat(radius.directImpact()).containsExactly("Web is unavailable or degraded");
        assertThat(radius.containment()).isEqualTo("Impact limited to Web");
    }

    @Test
    void slug_normalisesPunctuation() {
        assertThat(ExperimentCatalog.slug("  Auth / Identity Service ")).isEqualTo("auth-identity-service");
        assertThat(ExperimentCatalog.slug("***")).isEqualTo("component");
    }
}
