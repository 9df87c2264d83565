package com.example.ResearchGraph.model;

import java.util.List;

/**
 * Context handed to the generator plus the ids of the passages it contains.
 * {@code passageIds} is empty when the context came from metadata only.
 */
public record AssembledContext(
        List<String> context,
        List<String> passageIds
) {}
