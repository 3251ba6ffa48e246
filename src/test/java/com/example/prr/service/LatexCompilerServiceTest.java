package com.example.prr.service;

import com.example.prr.config.PrrProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link LatexCompilerService}.
 */
class LatexCompilerServiceTest {

    private static final String VERSION_BRANCH =
            "#!/bin/sh\nif [ \"$1\" = \"--version\" ]; then echo 'pdfTeX 3.141592653'; exit 0; fi\n";

    @TempDir
    Path workDir;

    @Test
    void extractLatexError_keepsErrorLines() {
        String output = "This is pdfTeX\n! Undefined control sequence.\nl.12 \\foo\nOutput written";

        assertThat(LatexCompilerService.extractLatexError(output)).isEqualTo("! Undefined control sequence.;");
    }

    @Test
    void extractLatexError_noErrorLines_returnsTail() {
        assertThat(LatexCompilerService.extractLatexError("line one\nline two")).isEqualTo("line one\nline two");
    }

    @Test
    void compile_missingPdflatex_throws() {
        LatexCompilerService service = service(workDir.resolve("no-such-pdflatex"), null);

        assertThatThrownBy(() -> service.compile(workDir.resolve("report.tex")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("pdflatex not found");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void compile_hangingPdflatex_timesOutAndKillsProcess() throws IOException {
        Path pdflatex = script("hanging-pdflatex", VERSION_BRANCH + "exec sleep 30\n");
        Path tex = Files.writeString(workDir.resolve("report.tex"), "\\documentclass{article}");
        LatexCompilerService service = service(pdflatex, Duration.ofMillis(500));

        long started = System.nanoTime();
        assertThatThrownBy(() -> service.compile(tex))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("pdflatex timeout after 500 ms on pass 1");
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(10));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void compile_failingPdflatex_reportsMarkedErrorLines() throws IOException {
        Path pdflatex = script("failing-pdflatex",
                VERSION_BRANCH + "echo 'This is pdfTeX'\necho '! Undefined control sequence.'\nexit 1\n");
        Path tex = Files.writeString(workDir.resolve("report.tex"), "\\documentclass{article}");

        assertThatThrownBy(() -> service(pdflatex, null).compile(tex))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("LaTeX compilation failed (exit code: 1): ! Undefined control sequence.;");
        assertThat(workDir.resolve("report.pdflatex.log")).content().contains("This is pdfTeX");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void compile_successfulPasses_returnsPdfBesideSource() throws IOException {
        Path pdflatex = script("ok-pdflatex", VERSION_BRANCH + "touch \"${3%.tex}.pdf\"\n");
        Path tex = Files.writeString(workDir.resolve("shop-prr.tex"), "\\documentclass{article}");

        Path pdf = service(pdflatex, null).compile(tex);

        assertThat(pdf).isEqualTo(workDir.toAbsolutePath().resolve("shop-prr.pdf")).isRegularFile();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void compile_noPdfProduced_throws() throws IOException {
        Path pdflatex = script("silent-pdflatex", VERSION_BRANCH + "exit 0\n");
        Path tex = Files.writeString(workDir.resolve("report.tex"), "\\documentclass{article}");

        assertThatThrownBy(() -> service(pdflatex, null).compile(tex))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("produced no PDF");
    }

    private LatexCompilerService service(Path pdflatex, Duration timeout) {
        return new LatexCompilerService(new PrrProperties(null, null, null, null, null,
                new PrrProperties.Latex(workDir.toString(), pdflatex.toString(), timeout)));
    }

    private Path script(String name, String body) throws IOException {
        Path bin = Files.createDirectories(workDir.resolve("bin"));
        Path script = Files.writeString(bin.resolve(name), body);
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        return script;
    }
}
