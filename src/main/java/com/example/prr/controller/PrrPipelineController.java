package com.example.prr.controller;

import com.example.prr.config.PrrProperties;
import com.example.prr.exception.ArtifactNotFoundException;
import com.example.prr.exception.InvalidInputException;
import com.example.prr.model.ArchitectureGraph;
import com.example.prr.model.ChaosTestPlan;
import com.example.prr.model.PipelineRun;
import com.example.prr.model.PrrDocument;
import com.example.prr.model.ProjectMetadata;
import com.example.prr.model.UploadedArtifact;
import com.example.prr.orchestrator.PipelineOrchestrator;
import com.example.prr.service.ArtifactStore;
import com.example.prr.service.LatexCompilerService;
import com.example.prr.service.LatexExportService;
import com.example.prr.service.PrrExportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * REST controller for the PRR pipeline.
 * Stateless: every stage receives its upstream artifacts in the request body.
 */
@RestController
@RequestMapping("/api")
public class PrrPipelineController {

    private static final Logger log = LoggerFactory.getLogger(PrrPipelineController.class);

    public record AnalysisRequest(String fileId, ProjectMetadata metadata) {}

    public record ResilienceRequest(ArchitectureGraph graph) {}

    public record PrrRequest(ProjectMetadata metadata, ArchitectureGraph graph, ChaosTestPlan plan) {}

    private final PipelineOrchestrator orchestrator;
    private final ArtifactStore artifactStore;
    private final PrrExportService exportService;
    private final LatexExportService latexExportService;
    private final LatexCompilerService latexCompilerService;
    private final PrrProperties properties;

    public PrrPipelineController(PipelineOrchestrator orchestrator,
                                 ArtifactStore artifactStore,
                                 PrrExportService exportService,
                                 LatexExportService latexExportService,
                                 LatexCompilerService latexCompilerService,
                                 PrrProperties properties) {
        this.orchestrator = orchestrator;
        this.artifactStore = artifactStore;
        this.exportService = exportService;
        this.latexExportService = latexExportService;
        this.latexCompilerService = latexCompilerService;
        this.properties = properties;
    }

    /**
     * Stores an architecture diagram and returns its id.
     *
     * <p>Endpoint: POST /api/upload-diagram
     * <p>Content-Type: multipart/form-data
     * <p>Parameter: file (image or PDF)
     */
    @PostMapping(value = "/upload-diagram", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> uploadDiagram(@RequestParam("file") MultipartFile file) {
        if (file.isEmpty()) {
            return badRequest("Empty file. Please upload an architecture diagram.");
        }
        long maxSize = properties.artifacts().maxSizeBytes();
        if (file.getSize() > maxSize) {
            return badRequest("File too large. Maximum size: %d bytes.".formatted(maxSize));
        }
        String contentType = file.getContentType() != null ? file.getContentType() : MediaType.APPLICATION_OCTET_STREAM_VALUE;
        log.info("Received diagram '{}' ({} bytes, {})", file.getOriginalFilename(), file.getSize(), contentType);

        return handle("upload", () -> {
            try {
                UploadedArtifact artifact = artifactStore.put(file.getBytes(), contentType, file.getOriginalFilename());
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("fileId", artifact.id());
                body.put("filename", artifact.filename() != null ? artifact.filename() : "");
                body.put("mimeType", artifact.mimeType());
                return ResponseEntity.ok(body);
            } catch (IOException e) {
                throw new InvalidInputException("Unreadable upload: " + e.getMessage(), e);
            }
        });
    }

    /**
     * <p>Endpoint: POST /api/analyze-system
     */
    @PostMapping("/analyze-system")
    public ResponseEntity<?> analyzeSystem(@RequestBody AnalysisRequest request) {
        log.info("Received analysis request for file ID: {}", request.fileId());
        return handle("architecture analysis",
                () -> ResponseEntity.ok(orchestrator.runArchitectureAnalysis(request.fileId(), request.metadata())));
    }

    /**
     * <p>Endpoint: POST /api/analyze-resilience
     */
    @PostMapping("/analyze-resilience")
    public ResponseEntity<?> analyzeResilience(@RequestBody ResilienceRequest request) {
        return handle("resilience planning",
                () -> ResponseEntity.ok(orchestrator.runResiliencePlan(request.graph())));
    }

    /**
     * <p>Endpoint: POST /api/generate-prr
     */
    @PostMapping("/generate-prr")
    public ResponseEntity<?> generatePrr(@RequestBody PrrRequest request) {
        return handle("PRR synthesis",
                () -> ResponseEntity.ok(orchestrator.runSynthesis(request.metadata(), request.graph(), request.plan())));
    }

    /**
     * Runs the full pipeline synchronously and returns the final run.
     *
     * <p>Endpoint: POST /api/runs
     */
    @PostMapping("/runs")
    public ResponseEntity<?> runPipeline(@RequestBody AnalysisRequest request) {
        return handle("pipeline run", () -> {
            PipelineRun run = orchestrator.create(request.metadata(), request.fileId());
            return ResponseEntity.ok(orchestrator.runToCompletion(run, () -> false));
        });
    }

    /**
     * <p>Endpoint: POST /api/export/text
     */
    @PostMapping(value = "/export/text", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<?> exportText(@RequestBody PrrDocument document) {
        return handle("text export", () -> ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(exportService.toPlainText(document)));
    }

    /**
     * Returns the PRR as a compiled PDF, or as LaTeX source if {@code format=tex} or if
     * compilation fails.
     *
     * <p>Endpoint: POST /api/export/latex?format=pdf|tex
     */
    @PostMapping("/export/latex")
    public ResponseEntity<?> exportLatex(@RequestBody PrrDocument document,
                                         @RequestParam(value = "format", defaultValue = "pdf") String format) {
        if (!format.equals("pdf") && !format.equals("tex")) {
            return badRequest("Unsupported format. Use 'pdf' or 'tex'.");
        }
        return handle("LaTeX export", () -> {
            Path texFile = latexExportService.write(document);
            if (format.equals("pdf")) {
                try {
                    Path pdfFile = latexCompilerService.compile(texFile);
                    return fileResponse(pdfFile, MediaType.APPLICATION_PDF, null);
                } catch (RuntimeException e) {
                    log.warn("PDF compilation failed (.tex file is still available): {}", e.getMessage());
                    return fileResponse(texFile, MediaType.TEXT_PLAIN,
                            "PDF compilation failed, returning LaTeX source file");
                }
            }
            return fileResponse(texFile, MediaType.TEXT_PLAIN, null);
        });
    }

    /**
     * <p>Endpoint: GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "service", "PRR-Pipeline",
                "inferenceMode", properties.inference().mode()
        ));
    }

    private ResponseEntity<?> handle(String operation, Supplier<ResponseEntity<?>> action) {
        try {
            return action.get();
        } catch (ArtifactNotFoundException e) {
            log.warn("{}: {}", operation, e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (InvalidInputException e) {
            log.warn("{}: invalid input: {}", operation, e.getMessage());
            return badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Error during {}", operation, e);
            return ResponseEntity.internalServerError()
                    .body(Map.of(
                            "error", "Error during " + operation,
                            "message", e.getMessage() != null ? e.getMessage() : "Unknown error"
                    ));
        }
    }

    private static ResponseEntity<Resource> fileResponse(Path path, MediaType mediaType, String warning) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + path.getFileName() + "\"");
        if (warning != null) {
            headers.set("X-Warning", warning);
        }
        return ResponseEntity.ok()
                .contentType(mediaType)
                .headers(headers)
                .body(new FileSystemResource(path));
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }
}
