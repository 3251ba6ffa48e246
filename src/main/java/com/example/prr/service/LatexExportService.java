package com.example.prr.service;

import com.example.prr.config.PrrProperties;
import com.example.prr.exception.InvalidInputException;
import com.example.prr.model.PrrDocument;
import com.example.prr.model.PrrSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Generates the PRR in LaTeX format.
 * <p>
 * Section bodies are split into paragraphs on blank lines; runs of lines starting
 * with {@code "- "} become itemize lists.
 */
@Service
public class LatexExportService {

    private static final Logger log = LoggerFactory.getLogger(LatexExportService.class);
    private static final DateTimeFormatter FOLDER = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final PrrProperties properties;
    private final SchemaValidator schemaValidator;
    private final Clock clock;

    public LatexExportService(PrrProperties properties, SchemaValidator schemaValidator, Clock clock) {
        this.properties = properties;
        this.schemaValidator = schemaValidator;
        this.clock = clock;
    }

    /**
     * Writes the document to {@code <outputDir>/<timestamp>/<slug>-prr.tex}.
     *
     * @return path to the generated .tex file
     */
    public Path write(PrrDocument document) {
        String latex = render(document);
        try {
            Path folder = Path.of(properties.latex().outputDir()).resolve(FOLDER.format(clock.instant()));
            Files.createDirectories(folder);
            Path texFile = folder.resolve(slug(document.title()) + "-prr.tex");
            Files.writeString(texFile, latex, StandardCharsets.UTF_8);
            log.info("LaTeX file generated: {}", texFile);
            return texFile;
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing the LaTeX file: " + e.getMessage(), e);
        }
    }

    public String render(PrrDocument document) {
        ValidationResult<PrrDocument> check = schemaValidator.validateDocument(document);
        if (!check.isValid()) {
            throw new InvalidInputException("Invalid PRR document: " + String.join("; ", check.errors()));
        }
        log.info("Rendering LaTeX for '{}' ({} sections)", document.title(), document.sections().size());

        var sb = new StringBuilder();
        sb.append("""
            \\documentclass[11pt,a4paper]{scrartcl}
            \\usepackage[utf8]{inputenc}
            \\usepackage[T1]{fontenc}
            \\usepackage[english]{babel}
            \\usepackage{hyperref}
            \\usepackage{enumitem}
            \\usepackage{geometry}
            \\usepackage{fancyhdr}
            \\geometry{a4paper, margin=2.5cm}
            \\setlength{\\emergencystretch}{3em}

            \\hypersetup{
              colorlinks=true,
              linkcolor=black,
              urlcolor=blue!70!black,
            }

            \\pagestyle{fancy}
            \\fancyhf{}
            \\fancyhead[L]{\\small Production Readiness Review}
            \\fancyhead[R]{\\small Version %s}
            \\fancyfoot[C]{\\thepage}

            \\title{%s}
            \\date{%s}
            \\begin{document}
            \\maketitle
            \\tableofcontents
            \\newpage
            """.formatted(
                escapeLatex(document.version()),
                escapeLatex(document.title()),
                document.generatedAt() != null ? PrrExportService.DATE.format(document.generatedAt()) : ""));

        if (document.degraded()) {
            sb.append("\\noindent\\textbf{Note:} parts of this review use fallback content "
                    + "and should be verified manually.\n\n");
        }
        for (PrrSection section : document.sections()) {
            sb.append("\\section{").append(escapeLatex(section.heading())).append("}\n");
            sb.append(renderBody(section.body()));
            sb.append("\n");
        }
        sb.append("\\end{document}\n");
        return sb.toString();
    }

    private String renderBody(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        var sb = new StringBuilder();
        for (String block : body.replace("\r\n", "\n").split("\\n\\s*\\n")) {
            List<String> lines = block.lines().toList();
            boolean inList = false;
            for (String line : lines) {
                String trimmed = line.trim();
                if (trimmed.startsWith("- ")) {
                    if (!inList) {
                        sb.append("\\begin{itemize}[nosep]\n");
                        inList = true;
                    }
                    sb.append("  \\item ").append(escapeLatex(trimmed.substring(2))).append('\n');
                } else {
                    if (inList) {
                        sb.append("\\end{itemize}\n");
                        inList = false;
                    }
                    if (!trimmed.isEmpty()) {
                        sb.append(escapeLatex(trimmed)).append("\\\\\n");
                    }
                }
            }
            if (inList) {
                sb.append("\\end{itemize}\n");
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    static String escapeLatex(String text) {
        if (text == null) return "";
        var sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\textbackslash{}");
                case '&' -> sb.append("\\&");
                case '%' -> sb.append("\\%");
                case '$' -> sb.append("\\$");
                case '#' -> sb.append("\\#");
                case '_' -> sb.append("\\_");
                case '{' -> sb.append("\\{");
                case '}' -> sb.append("\\}");
                case '~' -> sb.append("\\textasciitilde{}");
                case '^' -> sb.append("\\textasciicircum{}");
                case '>' -> sb.append("\\textgreater{}");
                case '<' -> sb.append("\\textless{}");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String slug(String title) {
        String slug = title.toLowerCase(Locale.ROOT)
                .replace("production readiness review", "")
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-|-$)", "");
        return slug.isEmpty() ? "service" : slug;
    }
}
