package com.example.prr.service;

import com.example.prr.config.PrrProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Renders PRR .tex files to PDF with an external pdflatex.
 * Two passes are run so the table of contents resolves. Each pass writes its console
 * output to {@code <name>.pdflatex.log} next to the source and is bounded by
 * {@code prr.latex.timeout}.
 */
@Service
public class LatexCompilerService {

    private static final Logger log = LoggerFactory.getLogger(LatexCompilerService.class);
    private static final int PASSES = 2;
    private static final Duration VERSION_CHECK_TIMEOUT = Duration.ofSeconds(10);

    private final PrrProperties.Latex latex;

    public LatexCompilerService(PrrProperties properties) {
        this.latex = properties.latex();
    }

    /**
     * Compiles the document and returns the path of the PDF beside it.
     *
     * @throws IllegalStateException if pdflatex is missing, reports an error, times out
     *                               or leaves no PDF behind
     */
    public Path compile(Path texFile) {
        Path source = texFile.toAbsolutePath();
        Path workDir = source.getParent();
        String baseName = source.getFileName().toString().replaceFirst("\\.tex$", "");
        Path consoleLog = workDir.resolve(baseName + ".pdflatex.log");

        log.info("Compiling {} with {} (timeout {})", source, latex.pdflatexPath(), latex.timeout());
        ensureAvailable();

        List<String> command = List.of(latex.pdflatexPath(), "-interaction=nonstopmode", "-halt-on-error",
                source.getFileName().toString());
        for (int pass = 1; pass <= PASSES; pass++) {
            runPass(command, workDir, consoleLog, pass);
        }

        Path pdf = workDir.resolve(baseName + ".pdf");
        if (!Files.isRegularFile(pdf)) {
            throw new IllegalStateException("pdflatex finished but produced no PDF: " + pdf);
        }
        try {
            log.info("PDF ready: {} ({} bytes)", pdf, Files.size(pdf));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read generated PDF " + pdf, e);
        }
        return pdf;
    }

    private void runPass(List<String> command, Path workDir, Path consoleLog, int pass) {
        log.debug("pdflatex pass {}/{}", pass, PASSES);
        Process process = start(new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(true)
                .redirectOutput(consoleLog.toFile()));

        if (!awaitExit(process, latex.timeout())) {
            throw new IllegalStateException("pdflatex timeout after %d ms on pass %d"
                    .formatted(latex.timeout().toMillis(), pass));
        }
        if (process.exitValue() != 0) {
            String detail = extractLatexError(readConsole(consoleLog));
            log.error("pdflatex pass {} exited with {}: {}", pass, process.exitValue(), detail);
            throw new IllegalStateException("LaTeX compilation failed (exit code: %d): %s"
                    .formatted(process.exitValue(), detail));
        }
    }

    private void ensureAvailable() {
        Process process;
        try {
            process = new ProcessBuilder(latex.pdflatexPath(), "--version")
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            throw new IllegalStateException("pdflatex not found. Install a LaTeX distribution (e.g. TeX Live). "
                    + "Searched path: " + latex.pdflatexPath(), e);
        }
        if (!awaitExit(process, VERSION_CHECK_TIMEOUT) || process.exitValue() != 0) {
            throw new IllegalStateException(
                    "pdflatex not available or not working. Install a LaTeX distribution (e.g. TeX Live).");
        }
    }

    private static Process start(ProcessBuilder builder) {
        try {
            return builder.start();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot start pdflatex: " + e.getMessage(), e);
        }
    }

    /**
     * Waits for the process; a process still alive after {@code timeout} is killed.
     *
     * @return whether the process exited on its own
     */
    private static boolean awaitExit(Process process, Duration timeout) {
        try {
            if (process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            process.destroyForcibly();
            return false;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LaTeX compilation interrupted", e);
        }
    }

    private static String readConsole(Path consoleLog) {
        try {
            return Files.readString(consoleLog, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Cannot read pdflatex output {}: {}", consoleLog, e.getMessage());
            return "";
        }
    }

    /**
     * Keeps the lines pdflatex marks as errors, or the last ten lines when none are marked.
     */
    static String extractLatexError(String output) {
        List<String> lines = output.lines().toList();
        String marked = lines.stream()
                .filter(line -> line.startsWith("!") || line.toLowerCase().contains("error"))
                .map(String::trim)
                .reduce("", (acc, line) -> acc + line + "; ");
        if (!marked.isEmpty()) {
            return marked.trim();
        }
        return String.join("\n", lines.subList(Math.max(0, lines.size() - 10), lines.size())).trim();
    }
}
