package com.example.ResearchGraph.common.convention.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned for every failed request.
 *
 * @param retryAfterSeconds only set for rate-limited requests
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResult(
        String code,
        String message,
        @JsonProperty("retry_after_seconds") Long retryAfterSeconds
) {

    public static ErrorResult of(String code, String message) {
        return new ErrorResult(code, message, null);
    }
}
