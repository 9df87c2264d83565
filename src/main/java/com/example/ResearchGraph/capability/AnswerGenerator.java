package com.example.ResearchGraph.capability;

import java.util.List;

/**
 * Produces a natural-language answer from a question and an ordered context.
 * Implementations report failures through {@link GenerationResult} instead of throwing.
 */
public interface AnswerGenerator {

    GenerationResult generate(String question, List<String> context);
}
