package com.example.ResearchGraph.common.convention.exception;

import com.example.ResearchGraph.common.convention.errorcode.RagErrorCode;
import lombok.Getter;

import java.time.Duration;

/**
 * The generation provider is temporarily exhausted. Callers should retry after {@link #getRetryAfter()}.
 */
@Getter
public class RateLimitedException extends AbstractException {

    private final Duration retryAfter;

    public RateLimitedException(Duration retryAfter) {
        super(
                "Answer generation rate limit reached. Please wait about "
                        + retryAfter.toSeconds() + " seconds and try again.",
                null,
                RagErrorCode.UPSTREAM_RATE_LIMITED
        );
        this.retryAfter = retryAfter;
    }
}
