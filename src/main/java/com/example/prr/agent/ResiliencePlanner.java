package com.example.prr.agent;

import com.example.prr.config.PrrProperties;
import com.example.prr.exception.InvalidInputException;
import com.example.prr.inference.InferenceRequest;
import com.example.prr.model.ArchitectureGraph;
import com.example.prr.model.BlastRadius;
import com.example.prr.model.ChaosExperiment;
import com.example.prr.model.ChaosTestPlan;
import com.example.prr.model.DependencyRisk;
import com.example.prr.model.ErrorCategory;
import com.example.prr.model.Finding;
import com.example.prr.model.Hypothesis;
import com.example.prr.model.OutputSchema;
import com.example.prr.model.PipelineIssue;
import com.example.prr.model.PipelineStage;
import com.example.prr.model.Provenance;
import com.example.prr.model.ResilienceNarrativeResponse;
import com.example.prr.model.RumsfeldMatrix;
import com.example.prr.model.SinglePointOfFailure;
import com.example.prr.model.StageOutcome;
import com.example.prr.model.SteadyState;
import com.example.prr.model.SystemComponent;
import com.example.prr.service.ExperimentCatalog;
import com.example.prr.service.GraphAnalyzer;
import com.example.prr.service.InferenceOutcome;
import com.example.prr.service.ResilientInferenceCaller;
import com.example.prr.service.SchemaValidator;
import com.example.prr.service.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resilience planning agent.
 * Ranks dependency risks, defines steady states and designs one chaos experiment per
 * top-ranked risk from the graph alone; the model only contributes the speculative
 * parts (hypotheses, unknowns, blast-radius prose), which are reconciled with the
 * experiments before the plan is returned.
 */
@Service
public class ResiliencePlanner {

    private static final Logger log = LoggerFactory.getLogger(ResiliencePlanner.class);

    private static final String SYSTEM_PROMPT = """
            You are a Site Reliability Engineer designing a chaos-engineering test plan
            for a Production Readiness Review.

            You receive the architecture of a system and a list of chaos experiments that
            have ALREADY been selected. Do NOT add, remove or rename experiments.

            TASK:
            1. hypotheses: for each experiment, a testable statement of how the system should
               behave under the fault (statement) and how to observe it (testApproach).
            2. knownUnknowns: risks the team is aware of but cannot yet quantify.
            3. unknownUnknowns: categories of failure nobody has anticipated yet.
            4. blastRadius: exactly ONE entry per experiment, using the experiment name VERBATIM:
               - experimentName: the exact experiment name
               - directImpact: immediate effects of the fault
               - indirectImpact: cascading effects on other components
               - containment: how far the impact is expected to spread
            5. recommendations: practices that reduce the uncertainty above.

            RULES (CRITICAL):
            - Refer to components only by the names listed in the architecture.
            - Do NOT state availability tiers or targets.

            OUTPUT FORMAT: Use a formal, professional, and objective tone throughout.
            Write everything in ENGLISH.
            """;

    private final ResilientInferenceCaller inferenceCaller;
    private final SchemaValidator schemaValidator;
    private final GraphAnalyzer graphAnalyzer;
    private final ExperimentCatalog catalog;
    private final int maxExperiments;

    public ResiliencePlanner(ResilientInferenceCaller inferenceCaller,
                             SchemaValidator schemaValidator,
                             GraphAnalyzer graphAnalyzer,
                             ExperimentCatalog catalog,
                             PrrProperties properties) {
        this.inferenceCaller = inferenceCaller;
        this.schemaValidator = schemaValidator;
        this.graphAnalyzer = graphAnalyzer;
        this.catalog = catalog;
        this.maxExperiments = properties.planning().maxExperiments();
    }

    /**
     * Builds the chaos test plan for a graph.
     *
     * @param graph architecture graph produced by extraction (or supplied by a caller)
     * @return plan outcome; degraded if the graph was degraded or the speculative parts fell back
     * @throws InvalidInputException if the graph is missing or violates its invariants
     */
    public StageOutcome<ChaosTestPlan> plan(ArchitectureGraph graph) {
        if (graph == null) {
            throw new InvalidInputException("Architecture graph is required for resilience planning");
        }
        ValidationResult<ArchitectureGraph> graphCheck = schemaValidator.validateGraph(graph);
        if (!graphCheck.isValid()) {
            throw new InvalidInputException("Invalid architecture graph: " + String.join("; ", graphCheck.errors()));
        }
        List<PipelineIssue> issues = new ArrayList<>();
        if (graph.isEmpty()) {
            log.warn("ResiliencePlanner: graph has no components, returning an empty plan");
            issues.add(issue(ErrorCategory.VALIDATION, "Architecture graph is empty; no experiments were planned"));
            return StageOutcome.of(ChaosTestPlan.empty(), true, issues);
        }

        List<DependencyRisk> risks = rankRisks(graph);
        List<SteadyState> steadyStates = graph.components().stream()
                .filter(c -> graph.isOnCriticalPath(c.name()))
                .map(c -> catalog.steadyStateFor(c, graph.availabilityTier()))
                .toList();
        List<ChaosExperiment> experiments = risks.stream()
                .limit(maxExperiments)
                .map(r -> catalog.experimentFor(graph.component(r.component()).orElseThrow()))
                .toList();
        List<Finding> knownKnowns = risks.stream()
                .map(r -> Finding.derived(r.name() + ": " + r.impact()))
                .toList();
        log.info("ResiliencePlanner: {} risks, {} steady states, {} experiments",
                risks.size(), steadyStates.size(), experiments.size());

        InferenceOutcome<ResilienceNarrativeResponse> outcome = inferenceCaller.call(
                narrativeRequest(graph, experiments),
                ResilienceNarrativeResponse.class,
                schemaValidator::validateResilienceNarrative);

        boolean degraded = graph.degraded();
        List<Hypothesis> hypotheses;
        List<Finding> knownUnknowns;
        List<Finding> unknownUnknowns;
        List<String> recommendations;
        List<BlastRadius> suppliedBlastRadius;
        if (outcome.isSuccess()) {
            ResilienceNarrativeResponse narrative = outcome.payload();
            outcome.notes().forEach(note -> issues.add(issue(ErrorCategory.VALIDATION, note)));
            hypotheses = narrative.hypotheses().stream().map(h -> h.withProvenance(Provenance.INFERRED)).toList();
            knownUnknowns = narrative.knownUnknowns().stream().map(Finding::inferred).toList();
            unknownUnknowns = narrative.unknownUnknowns().stream().map(Finding::inferred).toList();
            recommendations = narrative.recommendations();
            suppliedBlastRadius = narrative.blastRadius();
        } else {
            log.warn("ResiliencePlanner: narrative generation failed ({}), using fallback content",
                    outcome.failureSummary());
            issues.add(issue(outcome.category(),
                    "Resilience narrative generation failed, fallback content used: " + outcome.failureSummary()));
            degraded = true;
            hypotheses = catalog.fallbackHypotheses(experiments);
            knownUnknowns = catalog.fallbackKnownUnknowns();
            unknownUnknowns = catalog.fallbackUnknownUnknowns();
            recommendations = catalog.fallbackRecommendations();
            suppliedBlastRadius = List.of();
        }

        List<BlastRadius> blastRadius = reconcileBlastRadius(experiments, suppliedBlastRadius, graph, issues);
        ChaosTestPlan plan = new ChaosTestPlan(risks, steadyStates, hypotheses, experiments,
                new RumsfeldMatrix(knownKnowns, knownUnknowns, unknownUnknowns, recommendations),
                blastRadius, degraded);

        ValidationResult<ChaosTestPlan> check = schemaValidator.validatePlan(plan, graph);
        if (!check.isValid()) {
            throw new IllegalStateException("Derived plan violates its invariants: " + check.errors());
        }
        log.info("ResiliencePlanner: plan ready ({} hypotheses, {} blast-radius entries){}",
                hypotheses.size(), blastRadius.size(), degraded ? " (degraded)" : "");
        return StageOutcome.of(plan, degraded, issues);
    }

    /**
     * Components with at least one risk signal, ordered by SPOF, critical-path membership,
     * fan-in and finally declaration order.
     */
    List<DependencyRisk> rankRisks(ArchitectureGraph graph) {
        Map<String, Integer> fanIn = graphAnalyzer.fanIn(graph.components(), graph.dependencies());
        Map<String, String> spofImpact = graph.singlePointsOfFailure().stream()
                .collect(Collectors.toMap(SinglePointOfFailure::name, SinglePointOfFailure::impact, (a, b) -> a));
        List<SystemComponent> components = graph.components();

        Comparator<SystemComponent> ranking = Comparator
                .comparing((SystemComponent c) -> spofImpact.containsKey(c.name())).reversed()
                .thenComparing(Comparator.comparing((SystemComponent c) -> graph.isOnCriticalPath(c.name())).reversed())
                .thenComparing(Comparator.comparing((SystemComponent c) -> fanIn.get(c.name())).reversed())
                .thenComparingInt(components::indexOf);

        return components.stream()
                .filter(c -> spofImpact.containsKey(c.name())
                        || graph.isOnCriticalPath(c.name())
                        || fanIn.get(c.name()) > 0)
                .sorted(ranking)
                .map(c -> toRisk(c, spofImpact.get(c.name()), graph.isOnCriticalPath(c.name()),
                        fanIn.get(c.name()), graph))
                .toList();
    }

    private DependencyRisk toRisk(SystemComponent component, String spofImpact, boolean onPath, int fanIn,
                                  ArchitectureGraph graph) {
        String name = component.name();
        List<String> signals = new ArrayList<>();
        if (spofImpact != null) {
            signals.add("single point of failure");
        }
        if (onPath) {
            signals.add("on a critical user-to-data path");
        }
        if (fanIn > 0) {
            signals.add("depended on by " + fanIn + " component(s)");
        }
        String title = spofImpact != null ? name + " is a single point of failure"
                : onPath ? name + " sits on a critical path"
                : name + " is a shared dependency";

        String impact;
        if (spofImpact != null) {
            impact = spofImpact;
        } else {
            List<String> dependents = graphAnalyzer.directDependents(name, graph.dependencies());
            impact = dependents.isEmpty()
                    ? "Failure interrupts the critical path through " + name
                    : "Failure disrupts " + String.join(", ", dependents);
        }
        return new DependencyRisk(title, name + " (" + component.kind().wireValue() + ") is "
                + String.join(", ", signals), impact, name);
    }

    /**
     * Makes blast-radius entries match experiments one to one, in experiment order.
     * Orphans are removed, duplicates keep the first entry and missing entries are derived
     * from reverse reachability in the graph. Every repair is recorded as an issue.
     */
    List<BlastRadius> reconcileBlastRadius(List<ChaosExperiment> experiments, List<BlastRadius> supplied,
                                           ArchitectureGraph graph, List<PipelineIssue> issues) {
        Set<String> experimentNames = experiments.stream().map(ChaosExperiment::name)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Map<String, BlastRadius> byName = new LinkedHashMap<>();
        for (BlastRadius entry : supplied) {
            if (!experimentNames.contains(entry.experimentName())) {
                issues.add(issue(ErrorCategory.CONSISTENCY,
                        "Removed blast-radius entry '" + entry.experimentName() + "' with no matching experiment"));
            } else if (byName.containsKey(entry.experimentName())) {
                issues.add(issue(ErrorCategory.CONSISTENCY,
                        "Removed duplicate blast-radius entry for '" + entry.experimentName() + "'"));
            } else {
                byName.put(entry.experimentName(), entry);
            }
        }
        List<String> suppliedOrder = List.copyOf(byName.keySet());

        List<BlastRadius> reconciled = new ArrayList<>();
        for (ChaosExperiment experiment : experiments) {
            BlastRadius entry = byName.get(experiment.name());
            if (entry == null) {
                entry = deriveBlastRadius(experiment, graph);
                issues.add(issue(ErrorCategory.CONSISTENCY,
                        "Derived missing blast-radius entry for '" + experiment.name() + "' from graph reachability"));
            }
            reconciled.add(entry);
        }

        List<String> expectedOrder = experiments.stream().map(ChaosExperiment::name)
                .filter(byName::containsKey).toList();
        if (!suppliedOrder.equals(expectedOrder)) {
            issues.add(issue(ErrorCategory.CONSISTENCY, "Reordered blast-radius entries to match experiment order"));
        }
        return reconciled;
    }

    private BlastRadius deriveBlastRadius(ChaosExperiment experiment, ArchitectureGraph graph) {
        Set<String> targets = new LinkedHashSet<>(experiment.targetComponents());
        Set<String> direct = new LinkedHashSet<>();
        Set<String> transitive = new LinkedHashSet<>();
        for (String target : targets) {
            direct.addAll(graphAnalyzer.directDependents(target, graph.dependencies()));
        }
        for (String target : targets) {
            transitive.addAll(graphAnalyzer.transitiveDependents(target, graph.dependencies()));
        }
        direct.removeAll(targets);
        transitive.removeAll(targets);
        transitive.removeAll(direct);
        return catalog.derivedBlastRadius(experiment, List.copyOf(direct), List.copyOf(transitive));
    }

    private InferenceRequest narrativeRequest(ArchitectureGraph graph, List<ChaosExperiment> experiments) {
        String components = graph.components().stream()
                .map(c -> "- %s (%s): %s".formatted(c.name(), c.kind().wireValue(), c.description()))
                .collect(Collectors.joining("\n"));
        String dependencies = graph.dependencies().stream()
                .map(d -> "- %s -> %s (%s)".formatted(d.source(), d.target(), d.kind()))
                .collect(Collectors.joining("\n"));
        String spofs = graph.singlePointsOfFailure().stream()
                .map(s -> "- %s: %s".formatted(s.name(), s.impact()))
                .collect(Collectors.joining("\n"));
        String paths = graph.criticalPaths().stream()
                .map(p -> "- " + String.join(" -> ", p))
                .collect(Collectors.joining("\n"));
        String selected = experiments.stream()
                .map(e -> "- %s: %s (targets: %s)".formatted(e.name(), e.description(),
                        String.join(", ", e.targetComponents())))
                .collect(Collectors.joining("\n"));

        return new InferenceRequest(PipelineStage.PLANNING, OutputSchema.RESILIENCE_NARRATIVE, SYSTEM_PROMPT,
                """
                    ARCHITECTURE
                    Components:
                    %s
                    Dependencies:
                    %s
                    Single points of failure:
                    %s
                    Critical paths:
                    %s

                    SELECTED EXPERIMENTS (use these names verbatim):
                    %s

                    Produce hypotheses, known unknowns, unknown unknowns, one blast-radius entry
                    per experiment and recommendations. Write all output in ENGLISH.
                    """.formatted(orNone(components), orNone(dependencies), orNone(spofs), orNone(paths),
                        orNone(selected)),
                null);
    }

    private static String orNone(String block) {
        return block.isEmpty() ? "(none)" : block;
    }

    private static PipelineIssue issue(ErrorCategory category, String message) {
        return new PipelineIssue(category, PipelineStage.PLANNING, message);
    }
}
