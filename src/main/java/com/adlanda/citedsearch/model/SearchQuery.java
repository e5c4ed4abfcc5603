package com.adlanda.citedsearch.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Request body for the search endpoint, and the input of the hybrid query engine.
 *
 * Blank filters are treated as absent, so "all documents" can be sent as an empty string.
 *
 * @param text            Natural-language query
 * @param topK            Maximum number of results; null = configured default
 * @param fileFilter      Restrict to chunks whose {@code filename} equals this value
 * @param categoryFilter  Restrict to chunks whose {@code product_category} equals this value
 * @param alpha           Blend weight: 0 = pure lexical, 1 = pure semantic; null = configured default
 */
public record SearchQuery(
        @NotBlank(message = "Query text is required")
        String text,

        @Min(1)
        Integer topK,

        String fileFilter,

        String categoryFilter,

        @DecimalMin("0.0") @DecimalMax("1.0")
        Double alpha
) {
    public SearchQuery {
        fileFilter = blankToNull(fileFilter);
        categoryFilter = blankToNull(categoryFilter);
    }

    public static SearchQuery of(String text) {
        return new SearchQuery(text, null, null, null, null);
    }

    public SearchQuery withFileFilter(String filename) {
        return new SearchQuery(text, topK, filename, categoryFilter, alpha);
    }

    public boolean hasFilter() {
        return fileFilter != null || categoryFilter != null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
