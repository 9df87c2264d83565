package com.example.ResearchGraph.capability;

import java.time.Duration;

/**
 * Outcome of one generation call.
 */
public sealed interface GenerationResult
        permits GenerationResult.Generated, GenerationResult.RateLimited, GenerationResult.Failed {

    /**
     * @param tokensUsed prompt plus completion tokens, 0 when the provider reports no usage
     * @param model      model that produced the answer
     */
    record Generated(String answer, int tokensUsed, String model) implements GenerationResult {
    }

    /**
     * Provider quota or rate limit exhausted; retrying after {@code retryAfter} is expected to work.
     */
    record RateLimited(Duration retryAfter, String detail) implements GenerationResult {
    }

    /**
     * Any other provider fault. Not retried.
     */
    record Failed(String detail, Throwable cause) implements GenerationResult {
    }
}
