package com.example.prr.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Configuration properties for the PRR pipeline.
 */
@ConfigurationProperties(prefix = "prr")
public record PrrProperties(
        Inference inference,
        Analysis analysis,
        Planning planning,
        Artifacts artifacts,
        Report report,
        Latex latex
) {

    public PrrProperties {
        inference = inference != null ? inference : new Inference(null, null, null, 0);
        analysis = analysis != null ? analysis : new Analysis(0);
        planning = planning != null ? planning : new Planning(0);
        artifacts = artifacts != null ? artifacts : new Artifacts(null, 0);
        report = report != null ? report : new Report(null);
        latex = latex != null ? latex : new Latex(null, null, null);
    }

    /** Defaults for every setting, used by tests and when no configuration is bound. */
    public static PrrProperties defaults() {
        return new PrrProperties(null, null, null, null, null, null);
    }

    /**
     * Inference gateway settings.
     *
     * @param mode         {@code model} (Spring AI chat clients) or {@code fixture} (classpath fixtures)
     * @param timeout      Hard timeout of a single gateway call
     * @param retryBackoff Delay before retrying a timed-out or unavailable call
     * @param poolSize     Threads available for gateway calls and asynchronous runs
     */
    public record Inference(String mode, Duration timeout, Duration retryBackoff, int poolSize) {
        public Inference {
            mode = mode != null && !mode.isBlank() ? mode : "model";
            timeout = timeout != null ? timeout : Duration.ofSeconds(90);
            retryBackoff = retryBackoff != null ? retryBackoff : Duration.ofSeconds(2);
            poolSize = poolSize > 0 ? poolSize : 8;
        }
    }

    /**
     * Graph analysis limits.
     *
     * @param maxCriticalPaths Upper bound on enumerated critical paths
     */
    public record Analysis(int maxCriticalPaths) {
        public Analysis {
            maxCriticalPaths = maxCriticalPaths > 0 ? maxCriticalPaths : 50;
        }
    }

    /**
     * Resilience planning limits.
     *
     * @param maxExperiments Number of top-ranked dependency risks that get an experiment
     */
    public record Planning(int maxExperiments) {
        public Planning {
            maxExperiments = maxExperiments > 0 ? maxExperiments : 5;
        }
    }

    /**
     * Upload constraints.
     *
     * @param acceptedMimeTypes MIME types accepted for diagrams; {@code type/*} wildcards allowed
     * @param maxSizeBytes      Maximum upload size
     */
    public record Artifacts(List<String> acceptedMimeTypes, long maxSizeBytes) {
        public Artifacts {
            acceptedMimeTypes = acceptedMimeTypes != null && !acceptedMimeTypes.isEmpty()
                    ? List.copyOf(acceptedMimeTypes)
                    : List.of("image/*", "application/pdf");
            maxSizeBytes = maxSizeBytes > 0 ? maxSizeBytes : 20L * 1024 * 1024;
        }
    }

    /**
     * @param version Version stamped on generated documents
     */
    public record Report(String version) {
        public Report {
            version = version != null && !version.isBlank() ? version : "1.0";
        }
    }

    /**
     * Configuration for LaTeX export.
     *
     * @param outputDir    Output directory for generated files
     * @param pdflatexPath Path to the pdflatex executable
     * @param timeout      Limit for a single pdflatex pass
     */
    public record Latex(String outputDir, String pdflatexPath, Duration timeout) {
        public Latex {
            outputDir = outputDir != null && !outputDir.isBlank() ? outputDir : "reports";
            pdflatexPath = pdflatexPath != null && !pdflatexPath.isBlank() ? pdflatexPath : "pdflatex";
            timeout = timeout != null && !timeout.isNegative() && !timeout.isZero() ? timeout : Duration.ofSeconds(120);
        }
    }
}
