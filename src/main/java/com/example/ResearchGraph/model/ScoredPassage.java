package com.example.ResearchGraph.model;

import java.util.UUID;

/**
 * A passage returned by similarity search, with score = 1 - cosine distance.
 */
public record ScoredPassage(
        UUID id,
        String content,
        int chunkIndex,
        double score
) {}
