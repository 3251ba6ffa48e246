package com.example.prr.service;

import com.example.prr.model.ArchitectureExtractionResponse;
import com.example.prr.model.ArchitectureGraph;
import com.example.prr.model.BlastRadius;
import com.example.prr.model.ChaosExperiment;
import com.example.prr.model.ChaosTestPlan;
import com.example.prr.model.ComponentKind;
import com.example.prr.model.Dependency;
import com.example.prr.model.Hypothesis;
import com.example.prr.model.PrrDocument;
import com.example.prr.model.PrrSection;
import com.example.prr.model.PrrSectionHeading;
import com.example.prr.model.ReportNarrativeResponse;
import com.example.prr.model.ResilienceNarrativeResponse;
import com.example.prr.model.SinglePointOfFailure;
import com.example.prr.model.SteadyState;
import com.example.prr.model.SystemComponent;
import com.example.prr.model.Threshold;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Validates structured output at every stage boundary.
 * <p>
 * Model output is never trusted: each schema either coerces a safe deviation
 * (recorded as a note) or rejects the payload with a list of errors that is fed
 * back to the model in a corrective re-prompt.
 */
@Service
public class SchemaValidator {

    // ── ARCHITECTURE_GRAPH ──────────────────────────────────────────────────────

    /**
     * Validates the component/dependency listing extracted from a diagram.
     * <p>
     * Coerces: whitespace in names, duplicate components, missing kind (defaults to service),
     * endpoint case mismatches, self-loops and duplicate edges.
     * Rejects: missing component list, blank names, edges to unknown components.
     */
    public ValidationResult<ArchitectureExtractionResponse> validateExtraction(ArchitectureExtractionResponse candidate) {
        if (candidate == null) {
            return ValidationResult.invalid(List.of("Response is empty"));
        }
        if (candidate.components() == null) {
            return ValidationResult.invalid(List.of("Field 'components' is missing"));
        }

        List<String> errors = new ArrayList<>();
        List<String> notes = new ArrayList<>();

        List<SystemComponent> components = new ArrayList<>();
        Map<String, String> canonicalNames = new HashMap<>();
        for (int i = 0; i < candidate.components().size(); i++) {
            SystemComponent c = candidate.components().get(i);
            if (c == null || c.name() == null || c.name().isBlank()) {
                errors.add("components[%d]: name is required".formatted(i));
                continue;
            }
            String name = c.name().trim();
            String key = name.toLowerCase(Locale.ROOT);
            if (canonicalNames.containsKey(key)) {
                notes.add("Dropped duplicate component '%s'".formatted(name));
                continue;
            }
            ComponentKind kind = c.kind();
            if (kind == null) {
                kind = ComponentKind.SERVICE;
                notes.add("Component '%s' has no recognised kind, defaulted to service".formatted(name));
            }
            List<String> technologies = c.technologies().stream()
                    .map(String::trim)
                    .filter(t -> !t.isEmpty())
                    .toList();
            canonicalNames.put(key, name);
            components.add(new SystemComponent(name, kind,
                    c.description() != null ? c.description().trim() : "", technologies));
        }

        List<Dependency> dependencies = new ArrayList<>();
        Set<String> seenEdges = new HashSet<>();
        List<Dependency> rawDependencies = candidate.dependencies() != null ? candidate.dependencies() : List.of();
        for (int i = 0; i < rawDependencies.size(); i++) {
            Dependency d = rawDependencies.get(i);
            if (d == null) {
                errors.add("dependencies[%d]: entry is null".formatted(i));
                continue;
            }
            String source = resolve(canonicalNames, d.source());
            String target = resolve(canonicalNames, d.target());
            if (source == null) {
                errors.add("dependencies[%d]: source '%s' is not a listed component".formatted(i, d.source()));
            }
            if (target == null) {
                errors.add("dependencies[%d]: target '%s' is not a listed component".formatted(i, d.target()));
            }
            if (source == null || target == null) {
                continue;
            }
            if (source.equals(target)) {
                notes.add("Dropped self-dependency on '%s'".formatted(source));
                continue;
            }
            if (!seenEdges.add(source + "\u0000" + target)) {
                notes.add("Dropped duplicate dependency %s -> %s".formatted(source, target));
                continue;
            }
            String kind = d.kind() != null && !d.kind().isBlank() ? d.kind().trim() : "unspecified";
            dependencies.add(new Dependency(source, target, kind));
        }

        if (!errors.isEmpty()) {
            return ValidationResult.invalid(errors);
        }
        List<String> recommendations = candidate.recommendations() != null
                ? candidate.recommendations().stream().filter(r -> r != null && !r.isBlank()).map(String::trim).toList()
                : List.of();
        return ValidationResult.valid(
                new ArchitectureExtractionResponse(components, dependencies, recommendations), notes);
    }

    /**
     * Checks the referential invariant of a complete graph: every name in dependencies,
     * critical paths and SPOFs must be a component, and every critical path must follow
     * existing dependencies.
     */
    public ValidationResult<ArchitectureGraph> validateGraph(ArchitectureGraph graph) {
        if (graph == null) {
            return ValidationResult.invalid(List.of("Architecture graph is missing"));
        }
        List<String> errors = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (SystemComponent c : graph.components()) {
            if (c.name() == null || c.name().isBlank()) {
                errors.add("Component with blank name");
            } else if (!names.add(c.name())) {
                errors.add("Duplicate component name '%s'".formatted(c.name()));
            }
            if (c.kind() == null) {
                errors.add("Component '%s' has no kind".formatted(c.name()));
            }
        }

        Set<String> edges = new HashSet<>();
        for (Dependency d : graph.dependencies()) {
            requireName(names, d.source(), "dependency source", errors);
            requireName(names, d.target(), "dependency target", errors);
            edges.add(d.source() + "\u0000" + d.target());
        }
        for (List<String> path : graph.criticalPaths()) {
            path.forEach(n -> requireName(names, n, "critical path", errors));
            for (int i = 0; i + 1 < path.size(); i++) {
                if (!edges.contains(path.get(i) + "\u0000" + path.get(i + 1))) {
                    errors.add("Critical path %s is not a connected walk: no dependency %s -> %s"
                            .formatted(path, path.get(i), path.get(i + 1)));
                }
            }
        }
        for (SinglePointOfFailure spof : graph.singlePointsOfFailure()) {
            requireName(names, spof.name(), "single point of failure", errors);
        }
        if (graph.availabilityTier() == null) {
            errors.add("Availability tier is missing");
        }
        return errors.isEmpty() ? ValidationResult.valid(graph) : ValidationResult.invalid(errors);
    }

    // ── RESILIENCE_NARRATIVE ────────────────────────────────────────────────────

    /**
     * Validates the speculative plan content returned by the model. Blank entries are dropped;
     * a quadrant or the hypothesis list ending up empty is an error. Blast-radius entries are
     * only checked for shape here, their 1:1 match with experiments is repaired by the planner.
     */
    public ValidationResult<ResilienceNarrativeResponse> validateResilienceNarrative(ResilienceNarrativeResponse candidate) {
        if (candidate == null) {
            return ValidationResult.invalid(List.of("Response is empty"));
        }
        List<String> errors = new ArrayList<>();
        List<String> notes = new ArrayList<>();

        List<Hypothesis> hypotheses = candidate.hypotheses() == null ? List.of() : candidate.hypotheses().stream()
                .filter(h -> h != null && h.statement() != null && !h.statement().isBlank())
                .map(h -> new Hypothesis(h.statement().trim(),
                        h.testApproach() != null ? h.testApproach().trim() : "", h.provenance()))
                .toList();
        if (hypotheses.isEmpty()) {
            errors.add("Field 'hypotheses' must contain at least one hypothesis with a statement");
        }
        List<String> knownUnknowns = nonBlank(candidate.knownUnknowns());
        if (knownUnknowns.isEmpty()) {
            errors.add("Field 'knownUnknowns' must contain at least one entry");
        }
        List<String> unknownUnknowns = nonBlank(candidate.unknownUnknowns());
        if (unknownUnknowns.isEmpty()) {
            errors.add("Field 'unknownUnknowns' must contain at least one entry");
        }
        if (candidate.blastRadius() == null) {
            errors.add("Field 'blastRadius' is missing");
        }
        if (!errors.isEmpty()) {
            return ValidationResult.invalid(errors);
        }

        List<BlastRadius> blastRadius = new ArrayList<>();
        for (BlastRadius b : candidate.blastRadius()) {
            if (b == null || b.experimentName() == null || b.experimentName().isBlank()) {
                notes.add("Dropped blast-radius entry without experiment name");
                continue;
            }
            blastRadius.add(new BlastRadius(b.experimentName().trim(), nonBlank(b.directImpact()),
                    nonBlank(b.indirectImpact()), b.containment() != null ? b.containment().trim() : ""));
        }
        return ValidationResult.valid(new ResilienceNarrativeResponse(hypotheses, knownUnknowns,
                unknownUnknowns, blastRadius, nonBlank(candidate.recommendations())), notes);
    }

    /**
     * Checks the cross-artifact invariants of a complete plan against the graph it was derived from.
     */
    public ValidationResult<ChaosTestPlan> validatePlan(ChaosTestPlan plan, ArchitectureGraph graph) {
        if (plan == null) {
            return ValidationResult.invalid(List.of("Chaos test plan is missing"));
        }
        if (graph == null) {
            return ValidationResult.invalid(List.of("Architecture graph is missing"));
        }
        List<String> errors = new ArrayList<>();
        Set<String> names = graph.componentNames();

        Set<String> experimentNames = new LinkedHashSet<>();
        for (ChaosExperiment e : plan.experiments()) {
            if (e.name() == null || e.name().isBlank()) {
                errors.add("Experiment with blank name");
                continue;
            }
            if (!experimentNames.add(e.name())) {
                errors.add("Duplicate experiment name '%s'".formatted(e.name()));
            }
            if (e.targetComponents().isEmpty()) {
                errors.add("Experiment '%s' has no target components".formatted(e.name()));
            }
            e.targetComponents().forEach(t -> requireName(names, t, "experiment '" + e.name() + "' target", errors));
        }

        Set<String> blastNames = new HashSet<>();
        for (BlastRadius b : plan.blastRadius()) {
            if (!blastNames.add(b.experimentName())) {
                errors.add("Duplicate blast-radius entry for '%s'".formatted(b.experimentName()));
            }
            if (!experimentNames.contains(b.experimentName())) {
                errors.add("Blast-radius entry '%s' has no matching experiment".formatted(b.experimentName()));
            }
        }
        for (String name : experimentNames) {
            if (!blastNames.contains(name)) {
                errors.add("Experiment '%s' has no blast-radius entry".formatted(name));
            }
        }

        for (SteadyState s : plan.steadyStates()) {
            if (!Threshold.isParseable(s.threshold())) {
                errors.add("Steady state '%s' has unparseable threshold '%s'".formatted(s.name(), s.threshold()));
            }
            if (s.component() != null) {
                requireName(names, s.component(), "steady state '" + s.name() + "'", errors);
            }
        }
        plan.dependencyRisks().stream()
                .filter(r -> r.component() != null)
                .forEach(r -> requireName(names, r.component(), "dependency risk '" + r.name() + "'", errors));

        if (plan.rumsfeldMatrix().knownKnowns().size() < plan.dependencyRisks().size()) {
            errors.add("Known-knowns (%d) do not cover every dependency risk (%d)"
                    .formatted(plan.rumsfeldMatrix().knownKnowns().size(), plan.dependencyRisks().size()));
        }
        return errors.isEmpty() ? ValidationResult.valid(plan) : ValidationResult.invalid(errors);
    }

    // ── REPORT_NARRATIVE ────────────────────────────────────────────────────────

    /**
     * Validates section prose: headings are matched to the fixed section list (unknown ones dropped,
     * duplicates keep the first), and every section must end up with non-blank prose.
     */
    public ValidationResult<ReportNarrativeResponse> validateReportNarrative(ReportNarrativeResponse candidate) {
        if (candidate == null || candidate.sections() == null) {
            return ValidationResult.invalid(List.of("Field 'sections' is missing"));
        }
        List<String> notes = new ArrayList<>();
        Map<PrrSectionHeading, String> prose = new EnumMap<>(PrrSectionHeading.class);
        for (PrrSection section : candidate.sections()) {
            if (section == null) {
                continue;
            }
            PrrSectionHeading heading = PrrSectionHeading.fromValue(section.heading());
            if (heading == null) {
                notes.add("Dropped section with unknown heading '%s'".formatted(section.heading()));
                continue;
            }
            if (prose.containsKey(heading)) {
                notes.add("Dropped duplicate section '%s'".formatted(heading.title()));
                continue;
            }
            if (section.body() != null && !section.body().isBlank()) {
                prose.put(heading, section.body().trim());
            }
        }

        List<String> errors = new ArrayList<>();
        for (PrrSectionHeading heading : PrrSectionHeading.values()) {
            if (!prose.containsKey(heading)) {
                errors.add("Section '%s' is missing or empty".formatted(heading.title()));
            }
        }
        if (!errors.isEmpty()) {
            return ValidationResult.invalid(errors);
        }
        List<PrrSection> ordered = prose.entrySet().stream()
                .map(e -> new PrrSection(e.getKey().title(), e.getValue()))
                .toList();
        return ValidationResult.valid(new ReportNarrativeResponse(ordered), notes);
    }

    /**
     * Checks a document supplied for export: non-blank title and unique, non-blank headings.
     */
    public ValidationResult<PrrDocument> validateDocument(PrrDocument document) {
        if (document == null) {
            return ValidationResult.invalid(List.of("Document is missing"));
        }
        List<String> errors = new ArrayList<>();
        if (document.title() == null || document.title().isBlank()) {
            errors.add("Document title is required");
        }
        Set<String> headings = new HashSet<>();
        for (PrrSection section : document.sections()) {
            if (section.heading() == null || section.heading().isBlank()) {
                errors.add("Section with blank heading");
            } else if (!headings.add(section.heading())) {
                errors.add("Duplicate section heading '%s'".formatted(section.heading()));
            }
        }
        return errors.isEmpty() ? ValidationResult.valid(document) : ValidationResult.invalid(errors);
    }

    private static String resolve(Map<String, String> canonicalNames, String raw) {
        if (raw == null) {
            return null;
        }
        return canonicalNames.get(raw.trim().toLowerCase(Locale.ROOT));
    }

    private static void requireName(Set<String> names, String name, String where, List<String> errors) {
        if (name == null || !names.contains(name)) {
            errors.add("Unknown component '%s' referenced by %s".formatted(name, where));
        }
    }

    private static List<String> nonBlank(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(v -> v != null && !v.isBlank()).map(String::trim).toList();
    }
}
