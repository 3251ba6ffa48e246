package com.example.prr.orchestrator;

import com.example.prr.agent.ArchitectureExtractor;
import com.example.prr.agent.ReportSynthesizer;
import com.example.prr.agent.ResiliencePlanner;
import com.example.prr.exception.InvalidInputException;
import com.example.prr.model.ArchitectureGraph;
import com.example.prr.model.ChaosTestPlan;
import com.example.prr.model.PipelineRun;
import com.example.prr.model.PipelineStage;
import com.example.prr.model.PrrDocument;
import com.example.prr.model.ProjectMetadata;
import com.example.prr.model.StageOutcome;
import com.example.prr.service.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.BooleanSupplier;

/**
 * PRR pipeline orchestrator.
 * Pipeline:
 * 1. Architecture extraction (diagram to graph, SPOFs, critical paths, tier)
 * 2. Resilience planning (risks, steady states, experiments, Rumsfeld matrix, blast radius)
 * 3. Report synthesis (seven fixed sections with tier consistency guard)
 * <p>
 * Runs are immutable values: {@link #advance} moves a run by exactly one stage and
 * returns the new run. Stages of one run are sequential; independent runs share nothing
 * but the artifact store.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final ArtifactStore artifactStore;
    private final ArchitectureExtractor architectureExtractor;
    private final ResiliencePlanner resiliencePlanner;
    private final ReportSynthesizer reportSynthesizer;
    private final Clock clock;
    private final ExecutorService pipelineExecutor;

    public PipelineOrchestrator(ArtifactStore artifactStore,
                                ArchitectureExtractor architectureExtractor,
                                ResiliencePlanner resiliencePlanner,
                                ReportSynthesizer reportSynthesizer,
                                Clock clock,
                                @Qualifier("pipelineExecutor") ExecutorService pipelineExecutor) {
        this.artifactStore = artifactStore;
        this.architectureExtractor = architectureExtractor;
        this.resiliencePlanner = resiliencePlanner;
        this.reportSynthesizer = reportSynthesizer;
        this.clock = clock;
        this.pipelineExecutor = pipelineExecutor;
    }

    // ── Single-stage caller surface ─────────────────────────────────────────────

    public StageOutcome<ArchitectureGraph> runArchitectureAnalysis(String fileId, ProjectMetadata metadata) {
        return architectureExtractor.extract(fileId, metadata);
    }

    public StageOutcome<ChaosTestPlan> runResiliencePlan(ArchitectureGraph graph) {
        return resiliencePlanner.plan(graph);
    }

    public StageOutcome<PrrDocument> runSynthesis(ProjectMetadata metadata, ArchitectureGraph graph,
                                                  ChaosTestPlan plan) {
        return reportSynthesizer.synthesize(metadata, graph, plan);
    }

    // ── Run state machine ───────────────────────────────────────────────────────

    /**
     * Creates a run for an uploaded diagram.
     *
     * @throws InvalidInputException if the metadata is incomplete or the artifact is unknown
     */
    public PipelineRun create(ProjectMetadata metadata, String artifactId) {
        if (metadata == null) {
            throw new InvalidInputException("Project metadata is required");
        }
        metadata.validate();
        artifactStore.get(artifactId);
        PipelineRun run = PipelineRun.create(metadata, artifactId, clock.instant());
        log.info("Created run {} for '{}' (artifact {})", run.id(), metadata.name(), artifactId);
        return run;
    }

    /**
     * Executes the next stage of the run. Terminal runs are returned unchanged.
     */
    public PipelineRun advance(PipelineRun run) {
        return advance(run, PipelineRunListener.NONE);
    }

    public PipelineRun advance(PipelineRun run, PipelineRunListener listener) {
        if (run.state().isTerminal()) {
            return run;
        }
        PipelineStage stage = nextStage(run);
        PipelineRun started = run.begin(stage, clock.instant());
        listener.onUpdate(started);
        return execute(started, stage);
    }

    /**
     * Recomputes one stage from the artifacts already held by the run. Every artifact
     * downstream of the stage is cleared and its status reset.
     *
     * @throws InvalidInputException if the stage's upstream artifact is missing
     */
    public PipelineRun rerun(PipelineRun run, PipelineStage stage) {
        switch (stage) {
            case PLANNING -> {
                if (run.graph() == null) {
                    throw new InvalidInputException("Cannot re-run planning: run " + run.id() + " has no architecture graph");
                }
            }
            case SYNTHESIS -> {
                if (run.graph() == null || run.plan() == null) {
                    throw new InvalidInputException("Cannot re-run synthesis: run " + run.id() + " has no chaos test plan");
                }
            }
            case EXTRACTION -> { }
        }
        log.info("Re-running {} for run {}", stage, run.id());
        return execute(run.begin(stage, clock.instant()), stage);
    }

    /**
     * Drives the run until it reaches a terminal state. Cancellation is checked at stage
     * boundaries; a stage that finishes after cancellation was requested has its output
     * discarded and the run is returned as it was before that stage, cancelled.
     */
    public PipelineRun runToCompletion(PipelineRun run, BooleanSupplier cancelled) {
        return runToCompletion(run, cancelled, PipelineRunListener.NONE);
    }

    public PipelineRun runToCompletion(PipelineRun run, BooleanSupplier cancelled, PipelineRunListener listener) {
        log.info("═══════════════════════════════════════════════");
        log.info("Starting PRR pipeline for '{}' (run {})", run.metadata().name(), run.id());
        log.info("═══════════════════════════════════════════════");

        PipelineRun current = run;
        while (!current.state().isTerminal()) {
            PipelineStage stage = nextStage(current);
            if (cancelled.getAsBoolean()) {
                return cancel(current, "Cancelled before " + stage, listener);
            }
            PipelineRun next = advance(current, listener);
            if (cancelled.getAsBoolean()) {
                return cancel(current, "Cancelled during " + stage + "; its output was discarded", listener);
            }
            current = next;
            listener.onUpdate(current);
        }

        log.info("═══════════════════════════════════════════════");
        log.info("Pipeline finished for run {}: {}{}", current.id(), current.state(),
                current.degraded() ? " (degraded)" : "");
        log.info("═══════════════════════════════════════════════");
        return current;
    }

    /**
     * Runs the pipeline asynchronously on the pipeline executor.
     */
    public CompletableFuture<PipelineRun> submit(PipelineRun run, BooleanSupplier cancelled) {
        return CompletableFuture.supplyAsync(() -> runToCompletion(run, cancelled), pipelineExecutor);
    }

    private PipelineRun execute(PipelineRun started, PipelineStage stage) {
        int step = stage.ordinal() + 1;
        int steps = PipelineStage.values().length;
        try {
            return switch (stage) {
                case EXTRACTION -> {
                    log.info("[{}/{}] Extracting architecture...", step, steps);
                    StageOutcome<ArchitectureGraph> graph =
                            architectureExtractor.extract(started.artifactId(), started.metadata());
                    log.info("[{}/{}] Extraction completed: {} components, {}", step, steps,
                            graph.artifact().components().size(), graph.status());
                    yield started.withGraph(graph, clock.instant());
                }
                case PLANNING -> {
                    log.info("[{}/{}] Planning resilience tests...", step, steps);
                    StageOutcome<ChaosTestPlan> plan = resiliencePlanner.plan(started.graph().artifact());
                    log.info("[{}/{}] Planning completed: {} experiments, {}", step, steps,
                            plan.artifact().experiments().size(), plan.status());
                    yield started.withPlan(plan, clock.instant());
                }
                case SYNTHESIS -> {
                    log.info("[{}/{}] Synthesizing PRR document...", step, steps);
                    StageOutcome<PrrDocument> document = reportSynthesizer.synthesize(started.metadata(),
                            started.graph().artifact(), started.plan().artifact());
                    log.info("[{}/{}] Synthesis completed: {} sections, {}", step, steps,
                            document.artifact().sections().size(), document.status());
                    yield started.withDocument(document, clock.instant());
                }
            };
        } catch (InvalidInputException e) {
            log.warn("[{}/{}] {} failed on invalid input: {}", step, steps, stage, e.getMessage());
            return started.fail(stage, e.getMessage(), clock.instant());
        } catch (RuntimeException e) {
            log.error("[{}/{}] {} failed unexpectedly", step, steps, stage, e);
            return started.fail(stage, "Unexpected error in " + stage + ": " + e.getMessage(), clock.instant());
        }
    }

    private PipelineRun cancel(PipelineRun run, String reason, PipelineRunListener listener) {
        log.info("Run {} cancelled: {}", run.id(), reason);
        PipelineRun cancelled = run.cancel(reason, clock.instant());
        listener.onUpdate(cancelled);
        return cancelled;
    }

    private static PipelineStage nextStage(PipelineRun run) {
        return switch (run.state()) {
            case CREATED, EXTRACTING -> PipelineStage.EXTRACTION;
            case EXTRACTED, PLANNING -> PipelineStage.PLANNING;
            case PLANNED, SYNTHESIZING -> PipelineStage.SYNTHESIS;
            case COMPLETED, FAILED, CANCELLED ->
                    throw new IllegalStateException("Run " + run.id() + " is already " + run.state());
        };
    }
}
