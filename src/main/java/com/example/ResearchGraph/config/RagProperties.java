package com.example.ResearchGraph.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tunables for the paper Q&A pipeline, bound from the {@code rag.*} namespace.
 */
@Component
@ConfigurationProperties(prefix = "rag")
@Data
public class RagProperties {

    private Retrieval retrieval = new Retrieval();
    private Context context = new Context();
    private Embedding embedding = new Embedding();
    private Generation generation = new Generation();
    private Cache cache = new Cache();

    @Data
    public static class Retrieval {
        /** Number of passages pulled from the vector index per question. */
        private int topK = 5;
    }

    @Data
    public static class Context {
        /** Prepend the full metadata block to the context sent to the model. */
        private boolean richMetadata = true;
        /** How many reference ids are listed in the metadata block. */
        private int referencePreviewLimit = 20;
    }

    @Data
    public static class Embedding {
        /** Must match the dimension of paper_chunks.embedding. */
        private int dimensions = 768;
        private boolean verifyOnStartup = false;
    }

    @Data
    public static class Generation {
        /** ChatClient lookup key, e.g. "openai" or "deepseek". */
        private String provider = "openai";
        /** Recorded on cache entries when the provider does not report a model. */
        private String model = "gpt-4o-mini";
        private double temperature = 0.3;
        private int maxTokens = 1024;
        private Duration rateLimitRetryAfter = Duration.ofSeconds(60);
    }

    @Data
    public static class Cache {
        /** Share one in-flight generation between identical concurrent misses. */
        private boolean singleFlight = true;
        /** Longest a caller waits on another caller's generation for the same question. */
        private Duration singleFlightWait = Duration.ofSeconds(120);
    }
}
