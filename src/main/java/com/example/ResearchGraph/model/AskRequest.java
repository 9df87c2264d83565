package com.example.ResearchGraph.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * @param paperId  internal UUID or arXiv id of the paper
 * @param question free-text question, must not be blank
 */
public record AskRequest(
        @JsonProperty("paper_id") @NotBlank(message = "paper_id is required") String paperId,
        @NotBlank(message = "question is required") String question
) {}
