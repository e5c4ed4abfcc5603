package com.adlanda.citedsearch.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A unit of source text produced by the external document partitioner.
 *
 * Chunks are never mutated. Enrichment produces a new chunk that keeps the original id.
 *
 * @param id        Vendor-stable identifier (the partitioner's element id)
 * @param text      The chunk text as produced by the partitioner
 * @param metadata  Partitioner metadata; at least {@code filename} and {@code page_number}
 */
public record Chunk(
        String id,
        String text,
        Map<String, Object> metadata
) {
    public static final String FILENAME = "filename";
    public static final String PAGE_NUMBER = "page_number";
    public static final String PRODUCT_CATEGORY = "product_category";
    public static final String PRODUCT_ID = "product_id";
    public static final String PRODUCT_NAME = "product_name";
    public static final String TYPE = "type";

    public Chunk {
        Objects.requireNonNull(id, "Chunk id is required");
        text = text != null ? text : "";
        // Partitioner metadata may legitimately carry null values, so Map.copyOf is not an option
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }

    /**
     * Creates an enriched copy of this chunk with different text and the same id and metadata.
     */
    public Chunk withText(String newText) {
        return new Chunk(id, newText, metadata);
    }

    public String filename() {
        return stringValue(FILENAME);
    }

    /**
     * Raw stored page number. May be an integer, a float or a numeric string.
     */
    public Object pageNumber() {
        return metadata.get(PAGE_NUMBER);
    }

    public String type() {
        return stringValue(TYPE);
    }

    public String productCategory() {
        return stringValue(PRODUCT_CATEGORY);
    }

    public String productId() {
        return stringValue(PRODUCT_ID);
    }

    public String productName() {
        return stringValue(PRODUCT_NAME);
    }

    private String stringValue(String key) {
        Object value = metadata.get(key);
        return value != null ? value.toString() : null;
    }
}
