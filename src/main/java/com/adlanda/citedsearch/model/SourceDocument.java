package com.adlanda.citedsearch.model;

/**
 * A source document known to the catalog.
 *
 * @param filename         Document file name as stored in chunk metadata
 * @param productCategory  Product category, if any chunk carries one
 * @param productId        Product id, if any chunk carries one
 * @param productName      Product name, if any chunk carries one
 * @param chunkCount       Number of chunks loaded for this document
 */
public record SourceDocument(
        String filename,
        String productCategory,
        String productId,
        String productName,
        int chunkCount
) {}
