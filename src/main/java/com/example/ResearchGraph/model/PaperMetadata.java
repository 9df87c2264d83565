package com.example.ResearchGraph.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Read-only view of a row in {@code papers}.
 *
 * <p>Only {@code id} is guaranteed. Every scalar field may be null and is simply
 * left out wherever the paper is rendered. List fields are never null; a missing
 * or unparseable JSON column becomes an empty list.</p>
 */
public record PaperMetadata(
        UUID id,
        String arxivId,
        String title,
        String abstractText,
        List<String> authors,
        List<String> categories,
        OffsetDateTime publishedDate,
        String pdfUrl,
        List<String> references,
        List<String> citedBy
) {

    public PaperMetadata {
        authors = authors == null ? List.of() : List.copyOf(authors);
        categories = categories == null ? List.of() : List.copyOf(categories);
        references = references == null ? List.of() : List.copyOf(references);
        citedBy = citedBy == null ? List.of() : List.copyOf(citedBy);
    }

    public boolean hasAbstract() {
        return abstractText != null && !abstractText.isBlank();
    }
}
