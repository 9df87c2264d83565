package com.example.ResearchGraph.config;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Fails startup when the embedding model does not produce vectors of the configured
 * dimension. Off by default because it costs one embedding call.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "rag.embedding", name = "verify-on-startup", havingValue = "true")
public class EmbeddingDimensionVerifier implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingDimensionVerifier.class);

    private final EmbeddingModel embeddingModel;
    private final RagProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        int expected = properties.getEmbedding().getDimensions();
        int actual = embeddingModel.dimensions();
        if (actual != expected) {
            throw new IllegalStateException(
                    "Embedding model produces " + actual + "-dimensional vectors but rag.embedding.dimensions="
                            + expected + "; paper_chunks.embedding must use the same dimension");
        }
        log.info("Embedding dimension verified: {}", actual);
    }
}
