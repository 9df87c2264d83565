package com.example.ResearchGraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnswerSource {
    CACHE("cache"),
    LLM("llm");

    private final String value;

    AnswerSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
