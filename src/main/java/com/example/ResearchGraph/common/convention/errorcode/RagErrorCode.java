package com.example.ResearchGraph.common.convention.errorcode;

/**
 * Error codes of the paper Q&A service.
 *
 * <ul>
 *   <li>A0xxx: caused by the request (validation, unknown paper)</li>
 *   <li>B0xxx: internal faults (database, cache, embedding)</li>
 *   <li>C0xxx: the embedding or generation provider</li>
 * </ul>
 */
public enum RagErrorCode implements IErrorCode {

    SERVICE_ERROR("B0001", "Internal server error"),

    PARAM_EMPTY("A0101", "Required parameter is empty"),

    PARAM_INVALID("A0102", "Parameter is invalid"),

    QUESTION_EMPTY("A0103", "Question must not be empty"),

    PAPER_NOT_FOUND("A0401", "Paper not found"),

    /**
     * The paper exists but has neither indexed passages nor an abstract.
     */
    NO_CONTENT_AVAILABLE("A0402", "No content found for this paper."),

    EMBEDDING_SERVICE_ERROR("B0103", "Embedding service error"),

    CACHE_PERSISTENCE_ERROR("B0105", "Answer cache write failed"),

    UPSTREAM_RATE_LIMITED("C0101", "AI provider rate limit reached"),

    UPSTREAM_ERROR("C0102", "AI provider request failed");

    private final String code;
    private final String message;

    RagErrorCode(String code, String message) {
        this.code = code;
        this.message = message;
    }

    @Override
    public String code() {
        return this.code;
    }

    @Override
    public String message() {
        return this.message;
    }
}
