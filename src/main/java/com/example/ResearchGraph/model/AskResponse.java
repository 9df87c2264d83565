package com.example.ResearchGraph.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param contextUsed display strings of the context behind the answer; on a cache hit
 *                    only the passages that still exist are listed
 */
public record AskResponse(
        String answer,
        AnswerSource source,
        @JsonProperty("context_used") List<String> contextUsed
) {}
