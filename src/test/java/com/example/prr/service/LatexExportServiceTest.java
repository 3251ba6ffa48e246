package com.example.prr.service;

import com.example.prr.config.PrrProperties;
import com.example.prr.model.PrrDocument;
import com.example.prr.model.PrrSection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.example.prr.support.TestFixtures.NOW;
import static com.example.prr.support.TestFixtures.clock;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link LatexExportService}.
 */
class LatexExportServiceTest {

    @TempDir
    Path outputDir;

    private LatexExportService service() {
        PrrProperties properties = new PrrProperties(null, null, null, null, null,
                new PrrProperties.Latex(outputDir.toString(), null, null));
        return new LatexExportService(properties, new SchemaValidator(), clock());
    }

    private static PrrDocument document(boolean degraded) {
        return new PrrDocument("Shop Platform - Production Readiness Review", "1.0", NOW,
                List.of(new PrrSection("Identified Risks & Mitigations",
                        "Risks found: 2\n- API Gateway is a single point of failure\n- Error rate < 0.1%\n\nClosing note")),
                degraded);
    }

    @Test
    void render_escapesSpecialCharactersAndBuildsLists() {
        String latex = service().render(document(false));

        assertThat(latex)
                .contains("\\title{Shop Platform - Production Readiness Review}")
                .contains("\\section{Identified Risks \\& Mitigations}")
                .contains("Risks found: 2\\\\\n\\begin{itemize}[nosep]\n")
                .contains("  \\item Error rate \\textless{} 0.1\\%\n\\end{itemize}\n")
                .contains("Closing note\\\\")
                .doesNotContain("fallback content")
                .endsWith("\\end{document}\n");
    }

    @Test
    void render_degradedDocument_addsNote() {
        assertThat(service().render(document(true))).contains("parts of this review use fallback content");
    }

    @Test
    void write_createsTimestampedFolder() throws IOException {
        Path tex = service().write(document(false));

        assertThat(tex).isEqualTo(outputDir.resolve("20250314_093000").resolve("shop-platform-prr.tex"));
        assertThat(Files.readString(tex)).startsWith("\\documentclass");
    }

    @Test
    void escapeLatex_handlesBackslashAndBraces() {
        assertThat(LatexExportService.escapeLatex("a\\b{c}_d")).isEqualTo("a\\textbackslash{}b\\{c\\}\\_d");
        assertThat(LatexExportService.escapeLatex(null)).isEmpty();
    }
}
