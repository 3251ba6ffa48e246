package com.example.prr.agent;

import com.example.prr.config.PrrProperties;
import com.example.prr.exception.InvalidInputException;
import com.example.prr.inference.InferenceRequest;
import com.example.prr.model.ArchitectureExtractionResponse;
import com.example.prr.model.ArchitectureGraph;
import com.example.prr.model.BusinessImpact;
import com.example.prr.model.ComponentKind;
import com.example.prr.model.ErrorCategory;
import com.example.prr.model.OutputSchema;
import com.example.prr.model.PipelineIssue;
import com.example.prr.model.PipelineStage;
import com.example.prr.model.ProjectMetadata;
import com.example.prr.model.SinglePointOfFailure;
import com.example.prr.model.StageOutcome;
import com.example.prr.model.SystemComponent;
import com.example.prr.model.UploadedArtifact;
import com.example.prr.service.ArtifactStore;
import com.example.prr.service.GraphAnalyzer;
import com.example.prr.service.InferenceOutcome;
import com.example.prr.service.ResilientInferenceCaller;
import com.example.prr.service.SchemaValidator;
import com.example.prr.service.TierClassifier;
import com.example.prr.service.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.InvalidMimeTypeException;
import org.springframework.util.MimeType;
import org.springframework.util.MimeTypeUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Architecture extraction agent.
 * Reads an architecture diagram through the vision-capable model, validates the
 * component/dependency listing, then derives single points of failure, critical
 * paths and the availability tier deterministically from the resulting graph.
 */
@Service
public class ArchitectureExtractor {

    private static final Logger log = LoggerFactory.getLogger(ArchitectureExtractor.class);

    private static final String SYSTEM_PROMPT = """
            You are an SRE expert analyzing a system architecture diagram for a
            Production Readiness Review.

            TASK:
            Extract the structure of the system shown in the attached diagram.
            1. Components: every box, service, data store, client and third-party system.
               - name: the label used in the diagram (unique)
               - type: one of ui, api, service, database, external
               - description: one sentence on the component's purpose
               - technologies: technologies named in the diagram or implied by the label
            2. Dependencies: every arrow or connection between two components.
               - source: the component that calls or reads from the other
               - target: the component being called or read
               - type: nature of the connection (REST, gRPC, Database, Queue, Static Assets, ...)
            3. Recommendations: architecture improvements an SRE would propose.

            RULES (CRITICAL):
            - Every dependency endpoint MUST be the exact name of a listed component.
            - Do NOT invent components that are not shown or clearly implied by the diagram.
            - Do NOT compute single points of failure, critical paths or availability tiers:
              they are derived from your listing.
            - If the diagram shows no recognisable components, return an EMPTY components list.

            OUTPUT FORMAT: Use a formal, professional, and objective tone throughout.
            Write everything in ENGLISH.
            """;

    private final ArtifactStore artifactStore;
    private final ResilientInferenceCaller inferenceCaller;
    private final SchemaValidator schemaValidator;
    private final GraphAnalyzer graphAnalyzer;
    private final TierClassifier tierClassifier;
    private final List<MimeType> acceptedMimeTypes;
    private final int maxCriticalPaths;

    public ArchitectureExtractor(ArtifactStore artifactStore,
                                 ResilientInferenceCaller inferenceCaller,
                                 SchemaValidator schemaValidator,
                                 GraphAnalyzer graphAnalyzer,
                                 TierClassifier tierClassifier,
                                 PrrProperties properties) {
        this.artifactStore = artifactStore;
        this.inferenceCaller = inferenceCaller;
        this.schemaValidator = schemaValidator;
        this.graphAnalyzer = graphAnalyzer;
        this.tierClassifier = tierClassifier;
        this.acceptedMimeTypes = properties.artifacts().acceptedMimeTypes().stream()
                .map(MimeTypeUtils::parseMimeType)
                .toList();
        this.maxCriticalPaths = properties.analysis().maxCriticalPaths();
    }

    /**
     * Extracts the architecture graph of an uploaded diagram.
     *
     * @param artifactId identifier returned by the artifact store
     * @param metadata   project metadata
     * @return graph outcome; degraded if the model output could not be used
     * @throws InvalidInputException if the artifact is missing, empty or of an unsupported type,
     *                               or if the metadata is incomplete
     */
    public StageOutcome<ArchitectureGraph> extract(String artifactId, ProjectMetadata metadata) {
        if (metadata == null) {
            throw new InvalidInputException("Project metadata is required");
        }
        metadata.validate();
        UploadedArtifact artifact = artifactStore.get(artifactId);
        checkArtifact(artifact);

        log.info("ArchitectureExtractor: analyzing diagram for '{}' ({} bytes, {})",
                metadata.name(), artifact.size(), artifact.mimeType());

        InferenceRequest request = new InferenceRequest(
                PipelineStage.EXTRACTION,
                OutputSchema.ARCHITECTURE_GRAPH,
                SYSTEM_PROMPT,
                """
                    Analyze the attached architecture diagram with this context:

                    Project Name: %s
                    Description: %s
                    Business Impact: %s (%s)

                    List every component and every dependency shown in the diagram.
                    Write all output in ENGLISH.
                    """.formatted(metadata.name(), metadata.description(),
                        metadata.businessImpact().wireValue(), metadata.businessImpact().label()),
                artifact);

        InferenceOutcome<ArchitectureExtractionResponse> outcome =
                inferenceCaller.call(request, ArchitectureExtractionResponse.class, schemaValidator::validateExtraction);

        List<PipelineIssue> issues = new ArrayList<>();
        ArchitectureExtractionResponse listing;
        boolean degraded;
        if (outcome.isSuccess()) {
            listing = outcome.payload();
            outcome.notes().forEach(note -> issues.add(issue(ErrorCategory.VALIDATION, note)));
            degraded = listing.components().isEmpty();
            if (degraded) {
                log.warn("ArchitectureExtractor: no components recognised in the diagram");
                issues.add(issue(ErrorCategory.VALIDATION,
                        "No components were recognised in the diagram; the graph is empty"));
            }
        } else {
            log.warn("ArchitectureExtractor: extraction failed ({}), using single-component fallback",
                    outcome.failureSummary());
            issues.add(issue(outcome.category(),
                    "Architecture extraction failed, single-component fallback used: " + outcome.failureSummary()));
            listing = fallbackListing(metadata);
            degraded = true;
        }

        ArchitectureGraph graph = buildGraph(listing, metadata.businessImpact(), degraded, issues);
        ValidationResult<ArchitectureGraph> check = schemaValidator.validateGraph(graph);
        if (!check.isValid()) {
            throw new IllegalStateException("Derived graph violates its invariants: " + check.errors());
        }

        log.info("ArchitectureExtractor: {} components, {} dependencies, {} SPOFs, {} critical paths, {}{}",
                graph.components().size(), graph.dependencies().size(), graph.singlePointsOfFailure().size(),
                graph.criticalPaths().size(), graph.availabilityTier().label(), degraded ? " (degraded)" : "");
        return StageOutcome.of(graph, degraded, issues);
    }

    /**
     * Derives SPOFs, critical paths, tier and recommendations from a validated listing.
     */
    ArchitectureGraph buildGraph(ArchitectureExtractionResponse listing, BusinessImpact businessImpact,
                                 boolean degraded, List<PipelineIssue> issues) {
        List<SinglePointOfFailure> spofs =
                graphAnalyzer.findSinglePointsOfFailure(listing.components(), listing.dependencies());
        GraphAnalyzer.CriticalPaths paths =
                graphAnalyzer.findCriticalPaths(listing.components(), listing.dependencies(), maxCriticalPaths);
        if (paths.truncated()) {
            log.warn("ArchitectureExtractor: critical path enumeration stopped at {} paths", maxCriticalPaths);
            issues.add(issue(ErrorCategory.CONSISTENCY,
                    "Critical path enumeration truncated at " + maxCriticalPaths + " paths"));
        }
        TierClassifier.TierDecision tier =
                tierClassifier.classify(businessImpact, spofs.size(), paths.paths().size());

        Set<String> recommendations = new LinkedHashSet<>(listing.recommendations());
        spofs.forEach(s -> recommendations.add(
                "Add redundancy for " + s.name() + ", currently a single point of failure"));

        return new ArchitectureGraph(listing.components(), listing.dependencies(), paths.paths(), spofs,
                List.copyOf(recommendations), tier.tier(), tier.justification(), degraded);
    }

    private void checkArtifact(UploadedArtifact artifact) {
        if (artifact.size() == 0) {
            throw new InvalidInputException("Invalid artifact " + artifact.id() + ": file is empty");
        }
        MimeType actual;
        try {
            actual = MimeTypeUtils.parseMimeType(artifact.mimeType());
        } catch (InvalidMimeTypeException e) {
            throw new InvalidInputException("Invalid artifact " + artifact.id() + ": unreadable MIME type '"
                    + artifact.mimeType() + "'", e);
        }
        boolean accepted = acceptedMimeTypes.stream().anyMatch(type -> type.includes(actual));
        if (!accepted) {
            throw new InvalidInputException("Invalid artifact " + artifact.id() + ": unsupported type '"
                    + artifact.mimeType() + "', accepted: " + acceptedMimeTypes);
        }
    }

    private static ArchitectureExtractionResponse fallbackListing(ProjectMetadata metadata) {
        SystemComponent whole = new SystemComponent(metadata.name(), ComponentKind.SERVICE,
                metadata.description(), List.of());
        return new ArchitectureExtractionResponse(List.of(whole), List.of(), List.of(
                "Re-run the architecture analysis with a clearer diagram to obtain a component-level review"));
    }

    private static PipelineIssue issue(ErrorCategory category, String message) {
        return new PipelineIssue(category, PipelineStage.EXTRACTION, message);
    }
}
