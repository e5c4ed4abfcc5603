package com.adlanda.citedsearch.model;

import java.util.List;
import java.util.Map;

/**
 * The unit written to the vector index. One record per chunk, sharing the chunk's id.
 *
 * @param id        Chunk id
 * @param dense     Embedding vector (dimension fixed by the embedding model, e.g. 3072)
 * @param sparse    BM25 term weights; may be empty
 * @param metadata  Chunk metadata plus the raw {@code text}
 */
public record VectorRecord(
        String id,
        List<Double> dense,
        SparseVector sparse,
        Map<String, Object> metadata
) {
    public static final String TEXT = "text";
    public static final String TEXT_WITH_FILENAME = "text_with_filename";

    public VectorRecord {
        sparse = sparse != null ? sparse : SparseVector.empty();
        metadata = metadata != null ? metadata : Map.of();
    }

    public boolean hasDense() {
        return dense != null && !dense.isEmpty();
    }

    public String text() {
        Object text = metadata.get(TEXT);
        return text != null ? text.toString() : "";
    }
}
