package com.example.ResearchGraph.client;

import com.example.ResearchGraph.capability.EmbeddingProvider;
import com.example.ResearchGraph.common.convention.errorcode.RagErrorCode;
import com.example.ResearchGraph.common.convention.exception.ServiceException;
import com.example.ResearchGraph.config.RagProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Component;

/**
 * {@link EmbeddingProvider} backed by whichever Spring AI {@link EmbeddingModel} is configured.
 * Every vector is checked against {@code rag.embedding.dimensions}.
 */
@Component
@RequiredArgsConstructor
public class SpringAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbeddingProvider.class);

    private final EmbeddingModel embeddingModel;
    private final RagProperties properties;

    @Override
    public float[] embed(String text) {
        float[] vector;
        try {
            vector = embeddingModel.embed(text);
        } catch (RuntimeException ex) {
            log.error("Embedding request failed for text length={}", text == null ? 0 : text.length(), ex);
            throw new ServiceException(null, ex, RagErrorCode.UPSTREAM_ERROR);
        }

        int expected = dimensions();
        if (vector == null || vector.length != expected) {
            int actual = vector == null ? 0 : vector.length;
            log.error("Embedding model returned {} dimensions, configured {}", actual, expected);
            throw new ServiceException(
                    "Embedding has " + actual + " dimensions, expected " + expected,
                    RagErrorCode.EMBEDDING_SERVICE_ERROR
            );
        }
        return vector;
    }

    @Override
    public int dimensions() {
        return properties.getEmbedding().getDimensions();
    }
}
