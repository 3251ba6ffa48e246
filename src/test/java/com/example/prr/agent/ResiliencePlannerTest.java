package com.example.prr.agent;

import com.example.prr.exception.InvalidInputException;
import com.example.prr.inference.FixtureInferenceGateway;
import com.example.prr.inference.InferenceFailure;
import com.example.prr.inference.InferenceGateway;
import com.example.prr.model.ArchitectureGraph;
import com.example.prr.model.AvailabilityTier;
import com.example.prr.model.BlastRadius;
import com.example.prr.model.BusinessImpact;
import com.example.prr.model.ChaosExperiment;
import com.example.prr.model.ChaosTestPlan;
import com.example.prr.model.DependencyRisk;
import com.example.prr.model.ErrorCategory;
import com.example.prr.model.Finding;
import com.example.prr.model.Hypothesis;
import com.example.prr.model.OutputSchema;
import com.example.prr.model.PipelineIssue;
import com.example.prr.model.Provenance;
import com.example.prr.model.StageOutcome;
import com.example.prr.model.StageStatus;
import com.example.prr.model.SteadyState;
import com.example.prr.service.ExperimentCatalog;
import com.example.prr.service.GraphAnalyzer;
import com.example.prr.service.ResilientInferenceCaller;
import com.example.prr.service.SchemaValidator;
import com.example.prr.support.ScriptedInferenceGateway;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.example.prr.support.TestFixtures.ecommerceComponents;
import static com.example.prr.support.TestFixtures.ecommerceDependencies;
import static com.example.prr.support.TestFixtures.ecommerceGraph;
import static com.example.prr.support.TestFixtures.properties;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ResiliencePlanner}.
 */
class ResiliencePlannerTest {

    private static final List<String> TOP_EXPERIMENTS = List.of(
            "API Gateway Latency Injection",
            "Authentication Service CPU Stress",
            "Frontend Web App Network Partition",
            "Product Database Termination",
            "Product Service CPU Stress");

    private final ExperimentCatalog catalog = new ExperimentCatalog();

    private ResiliencePlanner planner(InferenceGateway gateway) {
        return new ResiliencePlanner(new ResilientInferenceCaller(gateway, properties()), new SchemaValidator(),
                new GraphAnalyzer(), catalog, properties());
    }

    @Test
    void plan_ecommerce_ranksRisksAndSelectsTopExperiments() {
        StageOutcome<ChaosTestPlan> outcome = planner(new FixtureInferenceGateway()).plan(ecommerceGraph(BusinessImpact.HIGH));

        ChaosTestPlan plan = outcome.artifact();
        assertThat(outcome.status()).isEqualTo(StageStatus.SUCCEEDED);
        assertThat(outcome.issues()).isEmpty();
        assertThat(plan.dependencyRisks()).extracting(DependencyRisk::component).containsExactly(
                "API Gateway", "Authentication Service", "Frontend Web App", "Product Database",
                "Product Service", "Inventory Service", "User Database", "CDN");
        assertThat(plan.experimentNames()).containsExactlyElementsOf(TOP_EXPERIMENTS);
        assertThat(plan.blastRadius()).extracting(BlastRadius::experimentName)
                .containsExactlyElementsOf(TOP_EXPERIMENTS);
    }

    @Test
    void plan_ecommerce_describesRisksFromGraphSignals() {
        ChaosTestPlan plan = planner(new FixtureInferenceGateway()).plan(ecommerceGraph(BusinessImpact.HIGH)).artifact();

        DependencyRisk gateway = plan.dependencyRisks().get(0);
        assertThat(gateway.name()).isEqualTo("API Gateway is a single point of failure");
        assertThat(gateway.description()).isEqualTo(
                "API Gateway (api) is single point of failure, on a critical user-to-data path, depended on by 1 component(s)");
        assertThat(gateway.impact()).startsWith("Failure of API Gateway cuts off 5 component(s)");

        DependencyRisk database = plan.dependencyRisks().get(3);
        assertThat(database.name()).isEqualTo("Product Database sits on a critical path");
        assertThat(database.impact()).isEqualTo("Failure disrupts Product Service, Inventory Service");

        DependencyRisk cdn = plan.dependencyRisks().get(7);
        assertThat(cdn.name()).isEqualTo("CDN is a shared dependency");
    }

    @Test
    void plan_ecommerce_keepsProvenanceOfEveryQuadrant() {
        ChaosTestPlan plan = planner(new FixtureInferenceGateway()).plan(ecommerceGraph(BusinessImpact.HIGH)).artifact();

        assertThat(plan.rumsfeldMatrix().knownKnowns()).hasSize(8)
                .extracting(Finding::provenance).containsOnly(Provenance.DERIVED);
        assertThat(plan.rumsfeldMatrix().knownUnknowns()).extracting(Finding::provenance)
                .containsOnly(Provenance.INFERRED);
        assertThat(plan.hypotheses()).extracting(Hypothesis::provenance).containsOnly(Provenance.INFERRED);
    }

    @Test
    void plan_ecommerce_buildsSteadyStatesForCriticalPathComponents() {
        ChaosTestPlan plan = planner(new FixtureInferenceGateway()).plan(ecommerceGraph(BusinessImpact.HIGH)).artifact();

        assertThat(plan.steadyStates()).extracting(SteadyState::component).containsExactly(
                "Frontend Web App", "API Gateway", "Authentication Service", "Product Service",
                "Inventory Service", "User Database", "Product Database");
        assertThat(plan.steadyStates().get(0).threshold()).isEqualTo(AvailabilityTier.TIER2.target());
        assertThat(plan.steadyStates()).allSatisfy(s -> assertThat(s.parsedThreshold()).isPresent());
    }

    @Test
    void plan_narrativeUnavailable_usesFallbackAndDerivedBlastRadius() {
        ScriptedInferenceGateway gateway = new ScriptedInferenceGateway()
                .fail(OutputSchema.RESILIENCE_NARRATIVE, InferenceFailure.TIMED_OUT);

        StageOutcome<ChaosTestPlan> outcome = planner(gateway).plan(ecommerceGraph(BusinessImpact.HIGH));

        ChaosTestPlan plan = outcome.artifact();
        assertThat(outcome.degraded()).isTrue();
        assertThat(plan.degraded()).isTrue();
        assertThat(plan.experimentNames()).containsExactlyElementsOf(TOP_EXPERIMENTS);
        assertThat(plan.hypotheses()).hasSize(5).extracting(Hypothesis::provenance).containsOnly(Provenance.FALLBACK);
        assertThat(plan.rumsfeldMatrix().unknownUnknowns()).extracting(Finding::provenance)
                .containsOnly(Provenance.FALLBACK);
        assertThat(plan.blastRadius()).hasSize(5);
        assertThat(plan.blastRadius().get(3).directImpact()).containsExactly(
                "Product Service loses reliable access to Product Database",
                "Inventory Service loses reliable access to Product Database");
        assertThat(outcome.issues()).extracting(PipelineIssue::category).containsExactly(
                ErrorCategory.INFERENCE_TRANSIENT,
                ErrorCategory.CONSISTENCY, ErrorCategory.CONSISTENCY, ErrorCategory.CONSISTENCY,
                ErrorCategory.CONSISTENCY, ErrorCategory.CONSISTENCY);
    }

    @Test
    void plan_degradedGraph_isDegradedEvenWhenNarrativeSucceeds() {
        ArchitectureGraph healthy = ecommerceGraph(BusinessImpact.HIGH);
        ArchitectureGraph degraded = new ArchitectureGraph(healthy.components(), healthy.dependencies(),
                healthy.criticalPaths(), healthy.singlePointsOfFailure(), healthy.recommendations(),
                healthy.availabilityTier(), healthy.tierJustification(), true);

        StageOutcome<ChaosTestPlan> outcome = planner(new FixtureInferenceGateway()).plan(degraded);

        assertThat(outcome.status()).isEqualTo(StageStatus.DEGRADED);
    }

    @Test
    void plan_emptyGraph_returnsEmptyPlanWithoutInference() {
        ScriptedInferenceGateway gateway = new ScriptedInferenceGateway();
        ArchitectureGraph empty = new ArchitectureGraph(List.of(), List.of(), List.of(), List.of(), List.of(),
                AvailabilityTier.TIER3, "", true);

        StageOutcome<ChaosTestPlan> outcome = planner(gateway).plan(empty);

        assertThat(outcome.artifact().experiments()).isEmpty();
        assertThat(outcome.degraded()).isTrue();
        assertThat(outcome.issues()).singleElement()
                .satisfies(issue -> assertThat(issue.category()).isEqualTo(ErrorCategory.VALIDATION));
        assertThat(gateway.requests()).isEmpty();
    }

    @Test
    void plan_invalidGraph_throws() {
        ArchitectureGraph broken = new ArchitectureGraph(ecommerceComponents(), ecommerceDependencies(),
                List.of(List.of("Frontend Web App", "Ghost")), List.of(), List.of(), AvailabilityTier.TIER2, "", false);

        assertThatThrownBy(() -> planner(new ScriptedInferenceGateway()).plan(broken))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("Ghost");
        assertThatThrownBy(() -> planner(new ScriptedInferenceGateway()).plan(null))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void reconcileBlastRadius_repairsOrphansDuplicatesOrderAndGaps() {
        ArchitectureGraph graph = ecommerceGraph(BusinessImpact.HIGH);
        ChaosExperiment gateway = catalog.experimentFor(graph.component("API Gateway").orElseThrow());
        ChaosExperiment database = catalog.experimentFor(graph.component("Product Database").orElseThrow());
        ChaosExperiment auth = catalog.experimentFor(graph.component("Authentication Service").orElseThrow());
        List<BlastRadius> supplied = List.of(
                entry(auth.name(), "first"),
                entry("Imaginary Experiment", "orphan"),
                entry(gateway.name(), "gateway"),
                entry(auth.name(), "duplicate"));
        List<PipelineIssue> issues = new ArrayList<>();

        List<BlastRadius> reconciled = planner(new ScriptedInferenceGateway())
                .reconcileBlastRadius(List.of(gateway, database, auth), supplied, graph, issues);

        assertThat(reconciled).extracting(BlastRadius::experimentName)
                .containsExactly(gateway.name(), database.name(), auth.name());
        assertThat(reconciled.get(2).containment()).isEqualTo("first");
        assertThat(reconciled.get(1).indirectImpact()).containsExactly(
                "API Gateway is degraded through its dependency chain",
                "Frontend Web App is degraded through its dependency chain");
        assertThat(issues).extracting(PipelineIssue::message).containsExactly(
                "Removed blast-radius entry 'Imaginary Experiment' with no matching experiment",
                "Removed duplicate blast-radius entry for 'Authentication Service CPU Stress'",
                "Derived missing blast-radius entry for 'Product Database Termination' from graph reachability",
                "Reordered blast-radius entries to match experiment order");
    }

    private static BlastRadius entry(String name, String containment) {
        return new BlastRadius(name, List.of("direct"), List.of(), containment);
    }
}
