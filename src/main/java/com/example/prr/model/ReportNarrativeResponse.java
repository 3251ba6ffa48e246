package com.example.prr.model;

import java.util.List;

/**
 * Narrative prose returned by the model, one entry per PRR section heading.
 */
public record ReportNarrativeResponse(List<PrrSection> sections) {}
