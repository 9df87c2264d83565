package com.example.ResearchGraph.service;

import com.example.ResearchGraph.config.RagProperties;
import com.example.ResearchGraph.model.PaperMetadata;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders paper metadata as a plain-text context block.
 *
 * <p>Factual questions (authors, dates, reference counts) are not reliably
 * answerable from similarity-ranked passages, so this block travels with them.
 * A missing field drops its line; nothing here throws on absent data.</p>
 */
@Component
@RequiredArgsConstructor
public class PaperContextFormatter {

    private final RagProperties properties;

    public String metadataBlock(PaperMetadata paper) {
        List<String> parts = new ArrayList<>();

        parts.add("Title: " + titleOf(paper));

        if (hasText(paper.arxivId())) {
            parts.add("arXiv ID: " + paper.arxivId());
        }

        if (!paper.authors().isEmpty()) {
            parts.add("Authors: " + String.join(", ", paper.authors()));
            parts.add("Number of authors: " + paper.authors().size());
        }

        if (paper.publishedDate() != null) {
            parts.add("Published: " + paper.publishedDate().toLocalDate());
        }

        if (!paper.categories().isEmpty()) {
            parts.add("Categories: " + String.join(", ", paper.categories()));
        }

        if (hasText(paper.pdfUrl())) {
            parts.add("PDF URL: " + paper.pdfUrl());
        }

        List<String> references = paper.references();
        if (!references.isEmpty()) {
            int limit = Math.max(0, properties.getContext().getReferencePreviewLimit());
            parts.add("Number of references: " + references.size());
            parts.add("References (arXiv IDs): "
                    + String.join(", ", references.subList(0, Math.min(limit, references.size()))));
        }

        if (!paper.citedBy().isEmpty()) {
            parts.add("Cited by: " + paper.citedBy().size() + " papers");
        }

        if (paper.hasAbstract()) {
            parts.add("\nAbstract:\n" + paper.abstractText());
        }

        return String.join("\n", parts);
    }

    /**
     * Minimal block used when rich metadata is switched off.
     */
    public String titleAndAbstract(PaperMetadata paper) {
        String block = "Title: " + titleOf(paper);
        return paper.hasAbstract() ? block + "\n\nAbstract:\n" + paper.abstractText() : block;
    }

    private String titleOf(PaperMetadata paper) {
        return hasText(paper.title()) ? paper.title() : "Unknown";
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
