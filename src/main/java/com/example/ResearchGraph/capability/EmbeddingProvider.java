package com.example.ResearchGraph.capability;

/**
 * Maps text to a fixed-length vector.
 * Repeated calls on identical text must rank passages the same way.
 */
public interface EmbeddingProvider {

    float[] embed(String text);

    /**
     * Dimension every returned vector has; must match the passage index.
     */
    int dimensions();
}
