package com.example.prr.agent;

import com.example.prr.config.PrrProperties;
import com.example.prr.exception.InvalidInputException;
import com.example.prr.inference.InferenceRequest;
import com.example.prr.model.ArchitectureGraph;
import com.example.prr.model.AvailabilityTier;
import com.example.prr.model.ChaosExperiment;
import com.example.prr.model.ChaosTestPlan;
import com.example.prr.model.ComponentKind;
import com.example.prr.model.DependencyRisk;
import com.example.prr.model.ErrorCategory;
import com.example.prr.model.OutputSchema;
import com.example.prr.model.PipelineIssue;
import com.example.prr.model.PipelineStage;
import com.example.prr.model.PrrDocument;
import com.example.prr.model.PrrSection;
import com.example.prr.model.PrrSectionHeading;
import com.example.prr.model.ProjectMetadata;
import com.example.prr.model.ReportNarrativeResponse;
import com.example.prr.model.SinglePointOfFailure;
import com.example.prr.model.StageOutcome;
import com.example.prr.model.SteadyState;
import com.example.prr.model.SystemComponent;
import com.example.prr.service.InferenceOutcome;
import com.example.prr.service.ResilientInferenceCaller;
import com.example.prr.service.SchemaValidator;
import com.example.prr.service.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Report synthesis agent.
 * Assembles the Production Readiness Review from upstream artifacts. Every section starts with
 * a fact block built from the graph and plan; the report model only writes the prose that
 * follows it, and any availability tier the prose mentions is forced to agree with the graph.
 */
@Service
public class ReportSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(ReportSynthesizer.class);

    /** Numeric ("tier 1", "Tier-2", "tier3") and spelled-out ("tier one") tier mentions. */
    static final Pattern TIER_MENTION = Pattern.compile("(?i)\\btier(?:[\\s-]?([1-4])|[\\s-](one|two|three|four))\\b");

    private static final List<String> TIER_WORDS = List.of("one", "two", "three", "four");

    private static final String SYSTEM_PROMPT = """
            You are a senior Site Reliability Engineer writing a Production Readiness Review (PRR).

            You receive the verified facts of the review: project metadata, architecture analysis,
            availability tier and the chaos test plan. Write the narrative of each section.

            SECTIONS (use these headings VERBATIM, one entry each, in this order):
            %s

            RULES (CRITICAL):
            - Each section body is 1-3 short paragraphs of prose.
            - Use ONLY the facts provided. Do NOT invent components, metrics or experiments.
            - Do NOT repeat the fact lists; explain what they mean for production readiness.
            - If you mention the availability tier, use exactly the tier given in the facts.

            OUTPUT FORMAT: Use a formal, professional, and objective tone throughout.
            Write everything in ENGLISH.
            """.formatted(Arrays.stream(PrrSectionHeading.values())
                    .map(h -> "- " + h.title())
                    .collect(Collectors.joining("\n")));

    private static final Map<PrrSectionHeading, String> FALLBACK_PROSE = new EnumMap<>(PrrSectionHeading.class);

    static {
        FALLBACK_PROSE.put(PrrSectionHeading.SERVICE_OVERVIEW,
                "This review summarises the production readiness of the service described above.");
        FALLBACK_PROSE.put(PrrSectionHeading.ARCHITECTURE_ANALYSIS,
                "The components and dependencies above were analysed for single points of failure "
                        + "and for the paths that connect users to data.");
        FALLBACK_PROSE.put(PrrSectionHeading.RESILIENCE_TESTING_STRATEGY,
                "Experiments are ordered by risk. Run each one against its steady-state baseline, "
                        + "starting in a staging environment.");
        FALLBACK_PROSE.put(PrrSectionHeading.AVAILABILITY_DESIGN,
                "Meeting the availability target requires removing the single points of failure listed "
                        + "in the architecture analysis.");
        FALLBACK_PROSE.put(PrrSectionHeading.OBSERVABILITY_STRATEGY,
                "Instrument every service, define alerts on the service level objectives above and "
                        + "review them after each experiment.");
        FALLBACK_PROSE.put(PrrSectionHeading.RISKS_AND_MITIGATIONS,
                "Mitigate each risk above with redundancy, timeouts and circuit breakers, and verify the "
                        + "mitigation with the matching experiment.");
        FALLBACK_PROSE.put(PrrSectionHeading.RECOMMENDATIONS,
                "Implement the recommendations above and schedule a follow-up review once they are in place.");
    }

    private final ResilientInferenceCaller inferenceCaller;
    private final SchemaValidator schemaValidator;
    private final Clock clock;
    private final String version;

    public ReportSynthesizer(ResilientInferenceCaller inferenceCaller,
                             SchemaValidator schemaValidator,
                             Clock clock,
                             PrrProperties properties) {
        this.inferenceCaller = inferenceCaller;
        this.schemaValidator = schemaValidator;
        this.clock = clock;
        this.version = properties.report().version();
    }

    /**
     * Synthesizes the PRR document. A missing graph or plan still yields a document, with
     * placeholder facts in the affected sections and the document marked degraded.
     *
     * @throws InvalidInputException if the metadata is missing or incomplete, or if a supplied
     *                               graph or plan violates its invariants
     */
    public StageOutcome<PrrDocument> synthesize(ProjectMetadata metadata, ArchitectureGraph graph, ChaosTestPlan plan) {
        if (metadata == null) {
            throw new InvalidInputException("Project metadata is required for report synthesis");
        }
        metadata.validate();
        checkUpstream(graph, plan);

        List<PipelineIssue> issues = new ArrayList<>();
        boolean degraded = false;
        if (graph == null) {
            issues.add(issue(ErrorCategory.VALIDATION, "Architecture graph unavailable; placeholder sections used"));
            degraded = true;
        } else if (graph.degraded()) {
            degraded = true;
        }
        if (plan == null) {
            issues.add(issue(ErrorCategory.VALIDATION, "Chaos test plan unavailable; placeholder sections used"));
            degraded = true;
        } else if (plan.degraded()) {
            degraded = true;
        }

        log.info("ReportSynthesizer: writing PRR for '{}'", metadata.name());
        Map<PrrSectionHeading, String> facts = factBlocks(metadata, graph, plan);

        InferenceOutcome<ReportNarrativeResponse> outcome = inferenceCaller.call(
                narrativeRequest(facts),
                ReportNarrativeResponse.class,
                schemaValidator::validateReportNarrative);

        Map<PrrSectionHeading, String> prose = new EnumMap<>(PrrSectionHeading.class);
        if (outcome.isSuccess()) {
            outcome.notes().forEach(note -> issues.add(issue(ErrorCategory.VALIDATION, note)));
            for (PrrSection section : outcome.payload().sections()) {
                prose.put(PrrSectionHeading.fromValue(section.heading()), section.body());
            }
        } else {
            log.warn("ReportSynthesizer: narrative generation failed ({}), using fallback prose",
                    outcome.failureSummary());
            issues.add(issue(outcome.category(),
                    "Report narrative generation failed, fallback prose used: " + outcome.failureSummary()));
            prose.putAll(FALLBACK_PROSE);
            degraded = true;
        }

        List<PrrSection> sections = new ArrayList<>();
        for (PrrSectionHeading heading : PrrSectionHeading.values()) {
            String text = prose.getOrDefault(heading, FALLBACK_PROSE.get(heading));
            if (graph != null) {
                text = enforceTier(heading, text, graph.availabilityTier(), issues);
            }
            sections.add(new PrrSection(heading.title(), facts.get(heading) + "\n\n" + text));
        }

        PrrDocument document = new PrrDocument(metadata.name() + " - Production Readiness Review",
                version, clock.instant(), sections, degraded);
        log.info("ReportSynthesizer: document ready ({} sections){}", sections.size(), degraded ? " (degraded)" : "");
        return StageOutcome.of(document, degraded, issues);
    }

    /**
     * Rewrites every tier mention that disagrees with the authoritative tier.
     */
    String enforceTier(PrrSectionHeading heading, String text, AvailabilityTier tier, List<PipelineIssue> issues) {
        Matcher matcher = TIER_MENTION.matcher(text);
        StringBuilder rewritten = new StringBuilder();
        while (matcher.find()) {
            int mentioned = matcher.group(1) != null
                    ? Integer.parseInt(matcher.group(1))
                    : TIER_WORDS.indexOf(matcher.group(2).toLowerCase(Locale.ROOT)) + 1;
            if (mentioned == tier.level()) {
                matcher.appendReplacement(rewritten, Matcher.quoteReplacement(matcher.group()));
            } else {
                issues.add(issue(ErrorCategory.CONSISTENCY, "Section '%s' mentioned '%s' but the assigned tier is %s; rewritten"
                        .formatted(heading.title(), matcher.group(), tier.label())));
                matcher.appendReplacement(rewritten, Matcher.quoteReplacement(tier.label()));
            }
        }
        matcher.appendTail(rewritten);
        return rewritten.toString();
    }

    // ── Fact blocks ─────────────────────────────────────────────────────────────

    Map<PrrSectionHeading, String> factBlocks(ProjectMetadata metadata, ArchitectureGraph graph, ChaosTestPlan plan) {
        Map<PrrSectionHeading, String> facts = new EnumMap<>(PrrSectionHeading.class);

        StringBuilder overview = new StringBuilder()
                .append("Project: ").append(metadata.name()).append('\n')
                .append("Description: ").append(metadata.description()).append('\n')
                .append("Business impact: ").append(metadata.businessImpact().wireValue())
                .append(" (").append(metadata.businessImpact().label()).append(')');
        if (graph != null) {
            overview.append('\n').append("Availability tier: ").append(graph.availabilityTier().label())
                    .append(" (").append(graph.availabilityTier().target()).append(')');
        }
        facts.put(PrrSectionHeading.SERVICE_OVERVIEW, overview.toString());

        facts.put(PrrSectionHeading.ARCHITECTURE_ANALYSIS, graph == null
                ? placeholder("Architecture analysis")
                : architectureFacts(graph));
        facts.put(PrrSectionHeading.AVAILABILITY_DESIGN, graph == null
                ? placeholder("Availability design")
                : availabilityFacts(graph));
        facts.put(PrrSectionHeading.RESILIENCE_TESTING_STRATEGY, plan == null
                ? placeholder("Resilience testing strategy")
                : testingFacts(plan));
        facts.put(PrrSectionHeading.OBSERVABILITY_STRATEGY, plan == null
                ? placeholder("Observability strategy")
                : observabilityFacts(plan));
        facts.put(PrrSectionHeading.RISKS_AND_MITIGATIONS, plan == null
                ? placeholder("Risk analysis")
                : riskFacts(plan));
        facts.put(PrrSectionHeading.RECOMMENDATIONS, recommendationFacts(graph, plan));
        return facts;
    }

    private static String architectureFacts(ArchitectureGraph graph) {
        Map<ComponentKind, Long> byKind = graph.components().stream()
                .collect(Collectors.groupingBy(SystemComponent::kind, () -> new EnumMap<>(ComponentKind.class),
                        Collectors.counting()));
        StringBuilder sb = new StringBuilder()
                .append("Components: ").append(graph.components().size());
        if (!byKind.isEmpty()) {
            sb.append(" (").append(byKind.entrySet().stream()
                    .map(e -> e.getKey().wireValue() + " " + e.getValue())
                    .collect(Collectors.joining(", "))).append(')');
        }
        sb.append('\n').append("Dependencies: ").append(graph.dependencies().size());
        sb.append('\n').append("Single points of failure: ").append(graph.singlePointsOfFailure().size());
        for (SinglePointOfFailure spof : graph.singlePointsOfFailure()) {
            sb.append('\n').append("- ").append(spof.name()).append(": ").append(spof.impact());
        }
        sb.append('\n').append("Critical paths: ").append(graph.criticalPaths().size());
        for (List<String> path : graph.criticalPaths()) {
            sb.append('\n').append("- ").append(String.join(" -> ", path));
        }
        return sb.toString();
    }

    private static String availabilityFacts(ArchitectureGraph graph) {
        AvailabilityTier tier = graph.availabilityTier();
        return "Availability tier: " + tier.label() + '\n'
                + "Target availability: " + tier.target() + '\n'
                + "Allowed downtime per year: " + tier.yearlyDowntime() + '\n'
                + "Justification: " + graph.tierJustification();
    }

    private static String testingFacts(ChaosTestPlan plan) {
        StringBuilder sb = new StringBuilder()
                .append("Dependency risks: ").append(plan.dependencyRisks().size()).append('\n')
                .append("Hypotheses: ").append(plan.hypotheses().size()).append('\n')
                .append("Experiments: ").append(plan.experiments().size());
        for (ChaosExperiment experiment : plan.experiments()) {
            sb.append('\n').append("- ").append(experiment.name()).append(": ").append(experiment.description());
        }
        return sb.toString();
    }

    private static String observabilityFacts(ChaosTestPlan plan) {
        if (plan.steadyStates().isEmpty()) {
            return "Service level objectives: none derived";
        }
        StringBuilder sb = new StringBuilder("Service level objectives:");
        for (SteadyState state : plan.steadyStates()) {
            sb.append('\n').append("- ").append(state.name()).append(": ").append(state.metric());
        }
        return sb.toString();
    }

    private static String riskFacts(ChaosTestPlan plan) {
        StringBuilder sb = new StringBuilder("Dependency risks: ").append(plan.dependencyRisks().size());
        for (DependencyRisk risk : plan.dependencyRisks()) {
            sb.append('\n').append("- ").append(risk.name()).append(": ").append(risk.impact());
        }
        sb.append('\n').append("Known unknowns: ").append(plan.rumsfeldMatrix().knownUnknowns().size())
                .append('\n').append("Unknown unknowns: ").append(plan.rumsfeldMatrix().unknownUnknowns().size());
        return sb.toString();
    }

    private static String recommendationFacts(ArchitectureGraph graph, ChaosTestPlan plan) {
        Set<String> recommendations = new LinkedHashSet<>();
        if (graph != null) {
            recommendations.addAll(graph.recommendations());
        }
        if (plan != null) {
            recommendations.addAll(plan.rumsfeldMatrix().recommendations());
        }
        if (recommendations.isEmpty()) {
            return placeholder("Recommendations");
        }
        return "Recommendations:\n" + recommendations.stream().map(r -> "- " + r).collect(Collectors.joining("\n"));
    }

    private static String placeholder(String what) {
        return what + " is not available: the upstream stage did not produce a result.";
    }

    private void checkUpstream(ArchitectureGraph graph, ChaosTestPlan plan) {
        if (graph == null) {
            return;
        }
        ValidationResult<ArchitectureGraph> graphCheck = schemaValidator.validateGraph(graph);
        if (!graphCheck.isValid()) {
            throw new InvalidInputException("Invalid architecture graph: " + String.join("; ", graphCheck.errors()));
        }
        if (plan != null) {
            ValidationResult<ChaosTestPlan> planCheck = schemaValidator.validatePlan(plan, graph);
            if (!planCheck.isValid()) {
                throw new InvalidInputException("Invalid chaos test plan: " + String.join("; ", planCheck.errors()));
            }
        }
    }

    private static InferenceRequest narrativeRequest(Map<PrrSectionHeading, String> facts) {
        String factText = facts.entrySet().stream()
                .map(e -> "## " + e.getKey().title() + "\n" + e.getValue())
                .collect(Collectors.joining("\n\n"));
        return new InferenceRequest(PipelineStage.SYNTHESIS, OutputSchema.REPORT_NARRATIVE, SYSTEM_PROMPT,
                """
                    Write the narrative for each section of the Production Readiness Review.

                    VERIFIED FACTS:
                    ---
                    %s
                    ---
                    Write all output in ENGLISH.
                    """.formatted(factText),
                null);
    }

    private static PipelineIssue issue(ErrorCategory category, String message) {
        return new PipelineIssue(category, PipelineStage.SYNTHESIS, message);
    }
}
