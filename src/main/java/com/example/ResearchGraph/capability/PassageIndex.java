package com.example.ResearchGraph.capability;

import com.example.ResearchGraph.model.ScoredPassage;

import java.util.List;
import java.util.UUID;

/**
 * Similarity search over the stored passages of one paper.
 */
public interface PassageIndex {

    /**
     * @return at most {@code k} passages of the paper, most similar first;
     *         equal scores keep passage insertion order
     */
    List<ScoredPassage> topK(UUID paperId, float[] queryVector, int k);
}
