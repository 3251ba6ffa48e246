package com.example.prr.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * The final Production Readiness Review.
 *
 * @param title       Document title
 * @param version     Document version
 * @param generatedAt Generation timestamp
 * @param sections    Sections, in {@link PrrSectionHeading} order
 * @param degraded    True if any section uses placeholder or fallback content
 */
public record PrrDocument(
        String title,
        String version,
        Instant generatedAt,
        List<PrrSection> sections,
        boolean degraded
) {
    public PrrDocument {
        sections = sections != null ? List.copyOf(sections) : List.of();
    }

    public Optional<PrrSection> section(PrrSectionHeading heading) {
        return sections.stream().filter(s -> s.heading().equals(heading.title())).findFirst();
    }
}
