package com.adlanda.citedsearch.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Request body for the answer endpoints.
 */
public record AnswerRequest(
        @NotBlank(message = "Question is required")
        String question,

        @Min(1)
        Integer topK,

        String fileFilter,

        String categoryFilter,

        @DecimalMin("0.0") @DecimalMax("1.0")
        Double alpha
) {
    public static AnswerRequest of(String question) {
        return new AnswerRequest(question, null, null, null, null);
    }

    public SearchQuery toSearchQuery() {
        return new SearchQuery(question, topK, fileFilter, categoryFilter, alpha);
    }
}
