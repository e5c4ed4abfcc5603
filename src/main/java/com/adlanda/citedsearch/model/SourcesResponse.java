package com.adlanda.citedsearch.model;

import java.util.List;

/**
 * Response body for the sources endpoint.
 *
 * @param indexSize  Number of records in the vector index
 * @param documents  Documents loaded from the chunks directory
 */
public record SourcesResponse(long indexSize, List<SourceDocument> documents) {}
