package com.example.prr.service;

import com.example.prr.exception.InvalidInputException;
import com.example.prr.model.PrrDocument;
import com.example.prr.model.PrrSection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Text and JSON renderings of a PRR document.
 */
@Service
public class PrrExportService {

    static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;
    private final SchemaValidator schemaValidator;

    public PrrExportService(ObjectMapper objectMapper, SchemaValidator schemaValidator) {
        this.objectMapper = objectMapper;
        this.schemaValidator = schemaValidator;
    }

    /**
     * Renders the document as plain text: a header block, then each section
     * as {@code ## heading}, a blank line and the body, sections separated by a blank line.
     */
    public String toPlainText(PrrDocument document) {
        requireValid(document);
        StringBuilder sb = new StringBuilder()
                .append("# ").append(document.title()).append('\n')
                .append("Version: ").append(document.version()).append('\n')
                .append("Date: ").append(document.generatedAt() != null ? DATE.format(document.generatedAt()) : "")
                .append('\n');
        for (PrrSection section : document.sections()) {
            sb.append('\n')
                    .append("## ").append(section.heading()).append("\n\n")
                    .append(section.body() != null ? section.body() : "").append('\n');
        }
        return sb.toString();
    }

    public String toJson(PrrDocument document) {
        requireValid(document);
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Error serializing the PRR document: " + e.getMessage(), e);
        }
    }

    private void requireValid(PrrDocument document) {
        ValidationResult<PrrDocument> check = schemaValidator.validateDocument(document);
        if (!check.isValid()) {
            throw new InvalidInputException("Invalid PRR document: " + String.join("; ", check.errors()));
        }
    }
}
