package com.adlanda.transcriptsearch.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Free-text search over the ingested transcript chunks.
 *
 * The question is embedded with the same model as the chunks, so it is capped well
 * below the provider's input limit. Surrounding whitespace is stripped.
 */
public record QueryRequest(
        @NotBlank(message = "Question is required")
        @Size(max = QueryRequest.MAX_QUESTION_LENGTH,
                message = "Question must be at most " + QueryRequest.MAX_QUESTION_LENGTH + " characters")
        String question,

        @Min(value = 1, message = "maxResults must be at least 1")
        @Max(value = QueryRequest.MAX_RESULTS, message = "maxResults must be at most " + QueryRequest.MAX_RESULTS)
        Integer maxResults
) {
    public static final int MAX_QUESTION_LENGTH = 1000;
    public static final int MAX_RESULTS = 20;
    public static final int DEFAULT_RESULTS = 5;

    public QueryRequest {
        if (question != null) {
            question = question.strip();
        }
        if (maxResults == null) {
            maxResults = DEFAULT_RESULTS;
        }
    }
}
