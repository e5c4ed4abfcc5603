package com.adlanda.citedsearch.model;

import java.util.List;

/**
 * Response from the search endpoint.
 *
 * @param results      Matched chunks in index relevance order
 * @param indexSize    Number of records in the index, or -1 when the index cannot report it cheaply
 * @param queryTimeMs  Time taken to process the query in milliseconds
 */
public record SearchResponse(
        List<SearchResult> results,
        long indexSize,
        long queryTimeMs
) {}
